package com.eduhub.data.schema;

import com.eduhub.data.domain.DomainModels.CourseLevel;
import com.eduhub.data.domain.DomainModels.EnrollmentStatus;
import com.eduhub.data.domain.DomainModels.StoredValue;
import com.eduhub.data.domain.DomainModels.UserRole;
import com.eduhub.data.schema.SchemaModels.CollectionSchema;
import com.eduhub.data.schema.SchemaModels.FieldConstraints;
import com.eduhub.data.schema.SchemaModels.FieldKind;
import com.eduhub.data.schema.SchemaModels.FieldRule;

import java.util.Arrays;
import java.util.List;

public final class EduHubSchemas {
    public static final String USERS = "users";
    public static final String COURSES = "courses";
    public static final String ENROLLMENTS = "enrollments";

    public static final CollectionSchema USER_SCHEMA = new CollectionSchema(USERS, List.of(
            FieldRule.required("email", FieldKind.STRING, FieldConstraints.matching("^\\S+@\\S+$")),
            FieldRule.required("firstName", FieldKind.STRING),
            FieldRule.required("lastName", FieldKind.STRING),
            FieldRule.required("role", FieldKind.STRING, valuesOf(UserRole.values())),
            FieldRule.required("dateJoined", FieldKind.DATE),
            FieldRule.required("isActive", FieldKind.BOOL)
    ));

    public static final CollectionSchema COURSE_SCHEMA = new CollectionSchema(COURSES, List.of(
            FieldRule.required("title", FieldKind.STRING),
            FieldRule.required("instructorId", FieldKind.OBJECT_ID),
            FieldRule.required("category", FieldKind.STRING),
            FieldRule.required("level", FieldKind.STRING, valuesOf(CourseLevel.values())),
            FieldRule.required("price", FieldKind.NUMBER, FieldConstraints.atLeast(0)),
            FieldRule.optional("tags", FieldKind.STRING_ARRAY),
            FieldRule.required("isPublished", FieldKind.BOOL),
            FieldRule.required("createdAt", FieldKind.DATE),
            FieldRule.required("updatedAt", FieldKind.DATE)
    ));

    public static final CollectionSchema ENROLLMENT_SCHEMA = new CollectionSchema(ENROLLMENTS, List.of(
            FieldRule.required("studentId", FieldKind.OBJECT_ID),
            FieldRule.required("courseId", FieldKind.OBJECT_ID),
            FieldRule.required("enrollmentDate", FieldKind.DATE),
            FieldRule.required("status", FieldKind.STRING, valuesOf(EnrollmentStatus.values()))
    ));

    public static final List<CollectionSchema> ALL = List.of(USER_SCHEMA, COURSE_SCHEMA, ENROLLMENT_SCHEMA);

    private EduHubSchemas() {}

    private static FieldConstraints valuesOf(StoredValue[] constants) {
        return FieldConstraints.oneOf(Arrays.stream(constants).map(StoredValue::value).toArray(String[]::new));
    }
}
