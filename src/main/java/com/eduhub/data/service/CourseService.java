package com.eduhub.data.service;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.repository.CourseMongoRepository;
import com.eduhub.data.repository.UserMongoRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class CourseService {
    private final CourseMongoRepository courseRepository;
    private final UserMongoRepository userRepository;
    private final Clock clock;

    public CourseService(CourseMongoRepository courseRepository, UserMongoRepository userRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    public String createCourse(DomainModels.NewCourse course) {
        String id = courseRepository.insert(course, Instant.now(clock));
        log.info("Created course {} ({}) by instructor {}", id, course.title(), course.instructorId());
        return id;
    }

    public Optional<DomainModels.Course> findCourseById(String id) {
        return courseRepository.findById(id);
    }

    public List<DomainModels.Course> findCoursesByCategory(String category) {
        return courseRepository.findByCategory(category);
    }

    public List<DomainModels.Course> findCoursesByTag(String tag) {
        return courseRepository.findByTag(tag);
    }

    public List<DomainModels.Course> findCoursesByInstructor(String instructorId) {
        return courseRepository.findByInstructor(instructorId);
    }

    public List<DomainModels.Course> findPublishedCourses() {
        return courseRepository.findPublished();
    }

    public List<DomainModels.Course> findCoursesByPriceRange(double min, double max) {
        if (min > max) return List.of();
        return courseRepository.findByPriceBetween(min, max);
    }

    public List<DomainModels.Course> searchCoursesByTitle(String text) {
        if (text == null || text.isBlank()) return List.of();
        return courseRepository.searchByTitle(text.trim());
    }

    public long markCourseAsPublished(String courseId) {
        long modified = courseRepository.markPublished(courseId, Instant.now(clock));
        if (modified > 0) {
            log.info("Published course {}", courseId);
        }
        return modified;
    }

    public Optional<DomainModels.CourseWithInstructor> getCourseWithInstructor(String courseId) {
        return courseRepository.findById(courseId)
                .map(course -> new DomainModels.CourseWithInstructor(course,
                        userRepository.findById(course.instructorId()).orElse(null)));
    }
}
