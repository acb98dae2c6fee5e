package com.eduhub.data;

import com.eduhub.data.api.CourseController;
import com.eduhub.data.api.EnrollmentController;
import com.eduhub.data.api.ReportController;
import com.eduhub.data.api.SchemaController;
import com.eduhub.data.api.UserController;
import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.ConnectivityException;
import com.eduhub.data.error.DuplicateRecordException;
import com.eduhub.data.error.ValidationException;
import com.eduhub.data.reporting.ReportingModels;
import com.eduhub.data.reporting.StatsReportService;
import com.eduhub.data.schema.SchemaManager;
import com.eduhub.data.service.CourseService;
import com.eduhub.data.service.EnrollmentService;
import com.eduhub.data.service.UserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {UserController.class, CourseController.class, EnrollmentController.class, ReportController.class, SchemaController.class})
class ApiControllerTest {
    @Autowired MockMvc mvc;
    @MockBean UserService userService;
    @MockBean CourseService courseService;
    @MockBean EnrollmentService enrollmentService;
    @MockBean StatsReportService statsReportService;
    @MockBean SchemaManager schemaManager;

    @Test
    void createsUserWithLowercaseRole() throws Exception {
        var expected = new DomainModels.NewUser("a@b.com", "A", "B", DomainModels.UserRole.STUDENT);
        when(userService.createUser(expected)).thenReturn("65a0000000000000000000f1");

        mvc.perform(post("/api/users").contentType("application/json")
                        .content("{\"email\":\"a@b.com\",\"firstName\":\"A\",\"lastName\":\"B\",\"role\":\"student\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("65a0000000000000000000f1"));
    }

    @Test
    void duplicateEmailIsConflict() throws Exception {
        when(userService.createUser(any())).thenThrow(new DuplicateRecordException("Duplicate key in users"));

        mvc.perform(post("/api/users").contentType("application/json")
                        .content("{\"email\":\"a@b.com\",\"firstName\":\"A\",\"lastName\":\"B\",\"role\":\"student\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void rejectedCourseIsBadRequest() throws Exception {
        when(courseService.createCourse(any())).thenThrow(new ValidationException("Document failed validation for courses"));

        mvc.perform(post("/api/courses").contentType("application/json")
                        .content("{\"title\":\"T\",\"instructorId\":\"65a0000000000000000000a1\",\"category\":\"C\",\"level\":\"beginner\",\"price\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"));
    }

    @Test
    void missingCourseIsNotFound() throws Exception {
        when(courseService.getCourseWithInstructor("nope")).thenReturn(Optional.empty());

        mvc.perform(get("/api/courses/nope/details"))
                .andExpect(status().isNotFound());
    }

    @Test
    void publishReportsModifiedCount() throws Exception {
        when(courseService.markCourseAsPublished("65a0000000000000000000c1")).thenReturn(0L);

        mvc.perform(post("/api/courses/65a0000000000000000000c1/publish"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modified").value(0));
    }

    @Test
    void profilePatchPassesMapThrough() throws Exception {
        when(userService.updateUserProfile("65a0000000000000000000f1", Map.of("lastName", "C"))).thenReturn(1L);

        mvc.perform(patch("/api/users/65a0000000000000000000f1").contentType("application/json")
                        .content("{\"lastName\":\"C\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modified").value(1));
    }

    @Test
    void enrollmentListingNeedsAFilter() throws Exception {
        mvc.perform(get("/api/enrollments"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void statsReportRendersRows() throws Exception {
        when(statsReportService.computeEnrollmentStats()).thenReturn(List.of(
                new ReportingModels.EnrollmentStatsRow("65a0000000000000000000c1", "Graphs", 10, 6, 0.6)));

        mvc.perform(get("/api/reports/enrollment-stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows[0].courseTitle").value("Graphs"))
                .andExpect(jsonPath("$.rows[0].enrollmentRate").value(0.6));
    }

    @Test
    void unreachableStoreIsServiceUnavailable() throws Exception {
        when(statsReportService.computeEnrollmentStats()).thenThrow(new ConnectivityException("Cannot reach store"));

        mvc.perform(get("/api/reports/enrollment-stats"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void courseSearchNeedsAFilter() throws Exception {
        mvc.perform(get("/api/courses"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"));
    }

    @Test
    void unclassifiedStoreFailureSharesErrorBody() throws Exception {
        when(enrollmentService.findEnrollmentsByStudent("65a0000000000000000000f1"))
                .thenThrow(new InvalidDataAccessApiUsageException("unsupported operator"));

        mvc.perform(get("/api/enrollments").param("studentId", "65a0000000000000000000f1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Store failure"))
                .andExpect(jsonPath("$.status").value(500));
    }

    @Test
    void schemaSetupRunsValidatorsThenIndexes() throws Exception {
        mvc.perform(post("/api/schema/setup"))
                .andExpect(status().isNoContent());

        var order = inOrder(schemaManager);
        order.verify(schemaManager).setupAll();
        order.verify(schemaManager).createIndexes();
    }
}
