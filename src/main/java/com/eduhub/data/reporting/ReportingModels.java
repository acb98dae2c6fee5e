package com.eduhub.data.reporting;

import java.util.List;

public class ReportingModels {
    public record EnrollmentStatsRow(String courseId,
                                     String courseTitle,
                                     long totalEnrollments,
                                     long activeStudents,
                                     double enrollmentRate) {}

    public record EnrollmentStatsResponse(List<EnrollmentStatsRow> rows) {}
}
