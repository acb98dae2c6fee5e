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
import java.util.regex.Pattern;

@Repository
public class CourseMongoRepository {
    private static final String COLLECTION = EduHubSchemas.COURSES;

    private final MongoTemplate mongoTemplate;

    public CourseMongoRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public String insert(DomainModels.NewCourse course, Instant now) {
        ObjectId id = new ObjectId();
        Document doc = new Document("_id", id)
                .append("title", course.title())
                .append("instructorId", Identifiers.require("instructorId", course.instructorId()))
                .append("category", course.category())
                .append("level", course.level() == null ? null : course.level().value())
                .append("price", course.price())
                .append("isPublished", false)
                .append("createdAt", Date.from(now))
                .append("updatedAt", Date.from(now));
        if (course.tags() != null) {
            doc.append("tags", course.tags());
        }
        try {
            mongoTemplate.insert(doc, COLLECTION);
        } catch (DataAccessException e) {
            throw StoreErrors.onWrite(COLLECTION, e);
        }
        return id.toHexString();
    }

    public Optional<DomainModels.Course> findById(String id) {
        Optional<ObjectId> oid = Identifiers.parse(id);
        if (oid.isEmpty()) return Optional.empty();
        try {
            return Optional.ofNullable(mongoTemplate.findOne(new Query(Criteria.where("_id").is(oid.get())), Document.class, COLLECTION))
                    .map(this::toCourse);
        } catch (DataAccessException e) {
            throw StoreErrors.onRead(COLLECTION, e);
        }
    }

    public List<DomainModels.Course> findByCategory(String category) {
        return find(new Query(Criteria.where("category").is(category)));
    }

    public List<DomainModels.Course> findByTag(String tag) {
        return find(new Query(Criteria.where("tags").is(tag)));
    }

    public List<DomainModels.Course> findByInstructor(String instructorId) {
        return Identifiers.parse(instructorId)
                .map(oid -> find(new Query(Criteria.where("instructorId").is(oid))))
                .orElse(List.of());
    }

    public List<DomainModels.Course> findPublished() {
        return find(new Query(Criteria.where("isPublished").is(true)));
    }

    public List<DomainModels.Course> findByPriceBetween(double min, double max) {
        return find(new Query(Criteria.where("price").gte(min).lte(max)));
    }

    public List<DomainModels.Course> searchByTitle(String text) {
        return find(new Query(Criteria.where("title").regex(Pattern.quote(text), "i")));
    }

    // already-published courses are filtered out, so a repeat call modifies nothing
    public long markPublished(String id, Instant now) {
        Optional<ObjectId> oid = Identifiers.parse(id);
        if (oid.isEmpty()) return 0;
        Query query = new Query(Criteria.where("_id").is(oid.get()).and("isPublished").ne(true));
        Update update = new Update().set("isPublished", true).set("updatedAt", Date.from(now));
        try {
            return mongoTemplate.updateFirst(query, update, COLLECTION).getModifiedCount();
        } catch (DataAccessException e) {
            throw StoreErrors.onWrite(COLLECTION, e);
        }
    }

    private List<DomainModels.Course> find(Query query) {
        try {
            return mongoTemplate.find(query, Document.class, COLLECTION).stream().map(this::toCourse).toList();
        } catch (DataAccessException e) {
            throw StoreErrors.onRead(COLLECTION, e);
        }
    }

    private DomainModels.Course toCourse(Document doc) {
        String level = doc.getString("level");
        Object price = doc.get("price");
        return new DomainModels.Course(
                Identifiers.hex(doc.get("_id")),
                doc.getString("title"),
                Identifiers.hex(doc.get("instructorId")),
                doc.getString("category"),
                level == null ? null : DomainModels.CourseLevel.fromValue(level),
                price instanceof Number ? ((Number) price).doubleValue() : 0.0,
                doc.getList("tags", String.class, List.of()),
                Boolean.TRUE.equals(doc.getBoolean("isPublished")),
                toInstant(doc.getDate("createdAt")),
                toInstant(doc.getDate("updatedAt")));
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
