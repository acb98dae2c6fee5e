package com.eduhub.data;

import com.eduhub.data.error.AggregationException;
import com.eduhub.data.error.ConnectivityException;
import com.eduhub.data.reporting.ReportingModels;
import com.eduhub.data.reporting.StatsReportService;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StatsReportServiceTest {
    private MongoTemplate mongoTemplate;
    private StatsReportService service;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        service = new StatsReportService(mongoTemplate);
    }

    @Test
    void mapsAggregationRowsToStatsRows() {
        ObjectId courseId = new ObjectId();
        Document row = new Document("courseId", courseId)
                .append("courseTitle", "Algorithms")
                .append("totalEnrollments", 10)
                .append("activeStudents", 6)
                .append("enrollmentRate", 0.6);
        when(mongoTemplate.aggregate(any(Aggregation.class), eq("enrollments"), eq(Document.class)))
                .thenReturn(new AggregationResults<>(List.of(row), new Document()));

        List<ReportingModels.EnrollmentStatsRow> rows = service.computeEnrollmentStats();

        assertEquals(List.of(new ReportingModels.EnrollmentStatsRow(courseId.toHexString(), "Algorithms", 10, 6, 0.6)), rows);
    }

    @Test
    void sendsTheFourStagePipeline() {
        when(mongoTemplate.aggregate(any(Aggregation.class), eq("enrollments"), eq(Document.class)))
                .thenReturn(new AggregationResults<>(List.of(), new Document()));

        service.computeEnrollmentStats();

        verify(mongoTemplate).aggregate(argThat((Aggregation a) -> a.toPipeline(Aggregation.DEFAULT_CONTEXT).size() == 4),
                eq("enrollments"), eq(Document.class));
    }

    @Test
    void noEnrollmentsYieldsEmptyTable() {
        when(mongoTemplate.aggregate(any(Aggregation.class), eq("enrollments"), eq(Document.class)))
                .thenReturn(new AggregationResults<>(List.of(), new Document()));

        assertTrue(service.computeEnrollmentStats().isEmpty());
    }

    @Test
    void rejectedPipelineSurfacesAsAggregationError() {
        when(mongoTemplate.aggregate(any(Aggregation.class), eq("enrollments"), eq(Document.class)))
                .thenThrow(new InvalidDataAccessApiUsageException("Unrecognized pipeline stage"));

        assertThrows(AggregationException.class, () -> service.computeEnrollmentStats());
    }

    @Test
    void unreachableStoreSurfacesAsConnectivityError() {
        when(mongoTemplate.aggregate(any(Aggregation.class), eq("enrollments"), eq(Document.class)))
                .thenThrow(new DataAccessResourceFailureException("no server"));

        assertThrows(ConnectivityException.class, () -> service.computeEnrollmentStats());
    }
}
