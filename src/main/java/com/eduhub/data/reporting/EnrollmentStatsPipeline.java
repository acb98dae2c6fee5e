package com.eduhub.data.reporting;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.schema.EduHubSchemas;
import org.bson.Document;

import java.util.List;

public final class EnrollmentStatsPipeline {
    static final String COURSE_FIELD = "course";

    private EnrollmentStatsPipeline() {}

    public static List<Document> stages() {
        return List.of(group(), lookupCourse(), unwindCourse(), project());
    }

    static Document group() {
        Document isActive = new Document("$eq", List.of("$status", DomainModels.EnrollmentStatus.ACTIVE.value()));
        return new Document("$group", new Document("_id", "$courseId")
                .append("totalEnrollments", new Document("$sum", 1))
                .append("activeStudents", new Document("$sum", new Document("$cond", List.of(isActive, 1, 0)))));
    }

    static Document lookupCourse() {
        return new Document("$lookup", new Document("from", EduHubSchemas.COURSES)
                .append("localField", "_id")
                .append("foreignField", "_id")
                .append("as", COURSE_FIELD));
    }

    // drops groups whose course no longer exists
    static Document unwindCourse() {
        return new Document("$unwind", "$" + COURSE_FIELD);
    }

    static Document project() {
        return new Document("$project", new Document("_id", 0)
                .append("courseId", "$_id")
                .append("courseTitle", "$" + COURSE_FIELD + ".title")
                .append("totalEnrollments", 1)
                .append("activeStudents", 1)
                .append("enrollmentRate", new Document("$divide", List.of("$activeStudents", "$totalEnrollments"))));
    }
}
