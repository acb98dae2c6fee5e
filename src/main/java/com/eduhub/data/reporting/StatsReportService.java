package com.eduhub.data.reporting;

import com.eduhub.data.error.StoreErrors;
import com.eduhub.data.repository.Identifiers;
import com.eduhub.data.schema.EduHubSchemas;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class StatsReportService {
    private final MongoTemplate mongoTemplate;

    public StatsReportService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public List<ReportingModels.EnrollmentStatsRow> computeEnrollmentStats() {
        List<AggregationOperation> operations = EnrollmentStatsPipeline.stages().stream()
                .map(stage -> (AggregationOperation) context -> stage)
                .toList();
        List<Document> results;
        try {
            results = mongoTemplate.aggregate(Aggregation.newAggregation(operations), EduHubSchemas.ENROLLMENTS, Document.class)
                    .getMappedResults();
        } catch (DataAccessException e) {
            throw StoreErrors.onAggregation(EduHubSchemas.ENROLLMENTS, e);
        }
        log.debug("Enrollment stats produced {} rows", results.size());
        return results.stream().map(this::toRow).toList();
    }

    private ReportingModels.EnrollmentStatsRow toRow(Document doc) {
        return new ReportingModels.EnrollmentStatsRow(
                Identifiers.hex(doc.get("courseId")),
                doc.getString("courseTitle"),
                number(doc, "totalEnrollments").longValue(),
                number(doc, "activeStudents").longValue(),
                number(doc, "enrollmentRate").doubleValue());
    }

    private static Number number(Document doc, String field) {
        Object value = doc.get(field);
        return value instanceof Number ? (Number) value : 0;
    }
}
