package com.eduhub.data.repository;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.StoreErrors;
import com.eduhub.data.schema.EduHubSchemas;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;

@Repository
public class EnrollmentMongoRepository {
    private static final String COLLECTION = EduHubSchemas.ENROLLMENTS;

    private final MongoTemplate mongoTemplate;

    public EnrollmentMongoRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public String insert(String studentId, String courseId, Instant enrollmentDate) {
        ObjectId id = new ObjectId();
        Document doc = new Document("_id", id)
                .append("studentId", Identifiers.require("studentId", studentId))
                .append("courseId", Identifiers.require("courseId", courseId))
                .append("enrollmentDate", Date.from(enrollmentDate))
                .append("status", DomainModels.EnrollmentStatus.ACTIVE.value());
        try {
            mongoTemplate.insert(doc, COLLECTION);
        } catch (DataAccessException e) {
            throw StoreErrors.onWrite(COLLECTION, e);
        }
        return id.toHexString();
    }

    public List<DomainModels.Enrollment> findByStudent(String studentId) {
        return findBy("studentId", studentId);
    }

    public List<DomainModels.Enrollment> findByCourse(String courseId) {
        return findBy("courseId", courseId);
    }

    public long updateStatus(String enrollmentId, DomainModels.EnrollmentStatus status) {
        Optional<ObjectId> oid = Identifiers.parse(enrollmentId);
        if (oid.isEmpty()) return 0;
        try {
            return mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(oid.get())),
                    new Update().set("status", status.value()), COLLECTION).getModifiedCount();
        } catch (DataAccessException e) {
            throw StoreErrors.onWrite(COLLECTION, e);
        }
    }

    private List<DomainModels.Enrollment> findBy(String field, String id) {
        Optional<ObjectId> oid = Identifiers.parse(id);
        if (oid.isEmpty()) return List.of();
        try {
            return mongoTemplate.find(new Query(Criteria.where(field).is(oid.get())), Document.class, COLLECTION).stream()
                    .map(this::toEnrollment)
                    .toList();
        } catch (DataAccessException e) {
            throw StoreErrors.onRead(COLLECTION, e);
        }
    }

    private DomainModels.Enrollment toEnrollment(Document doc) {
        Date enrolled = doc.getDate("enrollmentDate");
        String status = doc.getString("status");
        return new DomainModels.Enrollment(
                Identifiers.hex(doc.get("_id")),
                Identifiers.hex(doc.get("studentId")),
                Identifiers.hex(doc.get("courseId")),
                enrolled == null ? null : enrolled.toInstant(),
                status == null ? null : DomainModels.EnrollmentStatus.fromValue(status));
    }
}
