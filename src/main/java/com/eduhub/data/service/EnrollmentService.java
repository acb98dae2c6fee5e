package com.eduhub.data.service;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.ValidationException;
import com.eduhub.data.repository.EnrollmentMongoRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
public class EnrollmentService {
    private final EnrollmentMongoRepository repository;
    private final Clock clock;

    public EnrollmentService(EnrollmentMongoRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public String enrollStudent(String studentId, String courseId) {
        String id = repository.insert(studentId, courseId, Instant.now(clock));
        log.info("Enrolled student {} in course {}", studentId, courseId);
        return id;
    }

    public List<DomainModels.Enrollment> findEnrollmentsByStudent(String studentId) {
        return repository.findByStudent(studentId);
    }

    public List<DomainModels.Enrollment> findEnrollmentsByCourse(String courseId) {
        return repository.findByCourse(courseId);
    }

    public long updateEnrollmentStatus(String enrollmentId, DomainModels.EnrollmentStatus status) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        return repository.updateStatus(enrollmentId, status);
    }
}
