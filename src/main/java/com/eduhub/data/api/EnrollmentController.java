package com.eduhub.data.api;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.ValidationException;
import com.eduhub.data.service.EnrollmentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/enrollments")
public class EnrollmentController {
    private final EnrollmentService enrollmentService;

    public EnrollmentController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @PostMapping
    public ResponseEntity<UserController.CreatedResponse> enroll(@RequestBody EnrollRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new UserController.CreatedResponse(enrollmentService.enrollStudent(request.studentId(), request.courseId())));
    }

    @GetMapping
    public ResponseEntity<List<DomainModels.Enrollment>> list(@RequestParam(required = false) String studentId,
                                                              @RequestParam(required = false) String courseId) {
        if (studentId != null) return ResponseEntity.ok(enrollmentService.findEnrollmentsByStudent(studentId));
        if (courseId != null) return ResponseEntity.ok(enrollmentService.findEnrollmentsByCourse(courseId));
        throw new ValidationException("studentId or courseId is required");
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<UserController.ModifiedResponse> updateStatus(@PathVariable String id, @RequestBody StatusRequest request) {
        return ResponseEntity.ok(new UserController.ModifiedResponse(enrollmentService.updateEnrollmentStatus(id, request.status())));
    }

    public record EnrollRequest(String studentId, String courseId) {}

    public record StatusRequest(DomainModels.EnrollmentStatus status) {}
}
