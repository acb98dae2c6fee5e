package com.eduhub.data.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

public class DomainModels {
    public record User(String id, String email, String firstName, String lastName,
                       UserRole role, Instant dateJoined, boolean active) {}

    public record Course(String id, String title, String instructorId, String category,
                         CourseLevel level, double price, List<String> tags,
                         boolean published, Instant createdAt, Instant updatedAt) {}

    public record Enrollment(String id, String studentId, String courseId,
                             Instant enrollmentDate, EnrollmentStatus status) {}

    public record CourseWithInstructor(Course course, User instructor) {}

    public record NewUser(String email, String firstName, String lastName, UserRole role) {}

    public record NewCourse(String title, String instructorId, String category,
                            CourseLevel level, Double price, List<String> tags) {}

    // lower-case form kept in documents, validators and JSON
    public interface StoredValue {
        String value();
    }

    public enum UserRole implements StoredValue {
        STUDENT, INSTRUCTOR;

        @JsonValue
        @Override
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static UserRole fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public enum CourseLevel implements StoredValue {
        BEGINNER, INTERMEDIATE, ADVANCED;

        @JsonValue
        @Override
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static CourseLevel fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public enum EnrollmentStatus implements StoredValue {
        ACTIVE, COMPLETED, DROPPED;

        @JsonValue
        @Override
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static EnrollmentStatus fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
