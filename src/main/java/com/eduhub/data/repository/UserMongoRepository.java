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
import java.util.Map;
import java.util.Optional;

@Repository
public class UserMongoRepository {
    private static final String COLLECTION = EduHubSchemas.USERS;

    private final MongoTemplate mongoTemplate;

    public UserMongoRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public String insert(DomainModels.NewUser user, Instant dateJoined) {
        ObjectId id = new ObjectId();
        Document doc = new Document("_id", id)
                .append("email", user.email())
                .append("firstName", user.firstName())
                .append("lastName", user.lastName())
                .append("role", user.role() == null ? null : user.role().value())
                .append("dateJoined", Date.from(dateJoined))
                .append("isActive", true);
        try {
            mongoTemplate.insert(doc, COLLECTION);
        } catch (DataAccessException e) {
            throw StoreErrors.onWrite(COLLECTION, e);
        }
        return id.toHexString();
    }

    public Optional<DomainModels.User> findById(String id) {
        return Identifiers.parse(id).flatMap(oid -> findOne(Criteria.where("_id").is(oid)));
    }

    public Optional<DomainModels.User> findByEmail(String email) {
        return findOne(Criteria.where("email").is(email));
    }

    public List<DomainModels.User> findActiveByRole(DomainModels.UserRole role) {
        return find(new Query(Criteria.where("role").is(role.value()).and("isActive").is(true)));
    }

    public long update(String id, Map<String, Object> fields) {
        Optional<ObjectId> oid = Identifiers.parse(id);
        if (oid.isEmpty() || fields.isEmpty()) return 0;
        Update update = new Update();
        fields.forEach(update::set);
        try {
            return mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(oid.get())), update, COLLECTION).getModifiedCount();
        } catch (DataAccessException e) {
            throw StoreErrors.onWrite(COLLECTION, e);
        }
    }

    private Optional<DomainModels.User> findOne(Criteria criteria) {
        try {
            return Optional.ofNullable(mongoTemplate.findOne(new Query(criteria), Document.class, COLLECTION)).map(this::toUser);
        } catch (DataAccessException e) {
            throw StoreErrors.onRead(COLLECTION, e);
        }
    }

    private List<DomainModels.User> find(Query query) {
        try {
            return mongoTemplate.find(query, Document.class, COLLECTION).stream().map(this::toUser).toList();
        } catch (DataAccessException e) {
            throw StoreErrors.onRead(COLLECTION, e);
        }
    }

    private DomainModels.User toUser(Document doc) {
        Date joined = doc.getDate("dateJoined");
        String role = doc.getString("role");
        return new DomainModels.User(
                Identifiers.hex(doc.get("_id")),
                doc.getString("email"),
                doc.getString("firstName"),
                doc.getString("lastName"),
                role == null ? null : DomainModels.UserRole.fromValue(role),
                joined == null ? null : joined.toInstant(),
                Boolean.TRUE.equals(doc.getBoolean("isActive")));
    }
}
