package com.eduhub.data.api;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.NotFoundException;
import com.eduhub.data.error.ValidationException;
import com.eduhub.data.service.CourseService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
public class CourseController {
    private final CourseService courseService;

    public CourseController(CourseService courseService) {
        this.courseService = courseService;
    }

    @PostMapping
    public ResponseEntity<UserController.CreatedResponse> create(@RequestBody DomainModels.NewCourse request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new UserController.CreatedResponse(courseService.createCourse(request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DomainModels.Course> byId(@PathVariable String id) {
        return ResponseEntity.ok(courseService.findCourseById(id)
                .orElseThrow(() -> new NotFoundException("Course not found: " + id)));
    }

    @GetMapping("/{id}/details")
    public ResponseEntity<DomainModels.CourseWithInstructor> details(@PathVariable String id) {
        return ResponseEntity.ok(courseService.getCourseWithInstructor(id)
                .orElseThrow(() -> new NotFoundException("Course not found: " + id)));
    }

    @GetMapping
    public ResponseEntity<List<DomainModels.Course>> search(@RequestParam(required = false) String category,
                                                            @RequestParam(required = false) String tag,
                                                            @RequestParam(required = false) String title,
                                                            @RequestParam(required = false) String instructorId,
                                                            @RequestParam(required = false) Double minPrice,
                                                            @RequestParam(required = false) Double maxPrice,
                                                            @RequestParam(defaultValue = "false") boolean published) {
        if (category != null) return ResponseEntity.ok(courseService.findCoursesByCategory(category));
        if (tag != null) return ResponseEntity.ok(courseService.findCoursesByTag(tag));
        if (title != null) return ResponseEntity.ok(courseService.searchCoursesByTitle(title));
        if (instructorId != null) return ResponseEntity.ok(courseService.findCoursesByInstructor(instructorId));
        if (minPrice != null || maxPrice != null) {
            return ResponseEntity.ok(courseService.findCoursesByPriceRange(
                    minPrice == null ? 0.0 : minPrice,
                    maxPrice == null ? Double.MAX_VALUE : maxPrice));
        }
        if (published) return ResponseEntity.ok(courseService.findPublishedCourses());
        throw new ValidationException("One of category, tag, title, instructorId, minPrice/maxPrice or published=true is required");
    }

    @PostMapping("/{id}/publish")
    public ResponseEntity<UserController.ModifiedResponse> publish(@PathVariable String id) {
        return ResponseEntity.ok(new UserController.ModifiedResponse(courseService.markCourseAsPublished(id)));
    }
}
