package com.eduhub.data.schema;

import com.eduhub.data.error.StoreErrors;
import com.eduhub.data.schema.SchemaModels.CollectionSchema;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class SchemaManager {
    private final MongoTemplate mongoTemplate;

    public SchemaManager(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void setup(CollectionSchema schema) {
        String name = schema.collection();
        try {
            if (!mongoTemplate.collectionExists(name)) {
                createCollection(name);
            }
            log.info("Applying validation to collection: {}", name);
            mongoTemplate.executeCommand(new Document("collMod", name)
                    .append("validator", schema.toValidator())
                    .append("validationLevel", "strict")
                    .append("validationAction", "error"));
        } catch (DataAccessException e) {
            throw StoreErrors.onSchema(name, e);
        }
    }

    public void setupAll() {
        EduHubSchemas.ALL.forEach(this::setup);
    }

    public void createIndexes() {
        indexesByCollection().forEach((collection, indexes) -> {
            for (IndexDefinition index : indexes) {
                try {
                    String created = mongoTemplate.indexOps(collection).ensureIndex(index);
                    log.info("Ensured index {} on {}", created, collection);
                } catch (DataAccessException e) {
                    throw StoreErrors.onIndex(collection, e);
                }
            }
        });
    }

    Map<String, List<IndexDefinition>> indexesByCollection() {
        Map<String, List<IndexDefinition>> indexes = new LinkedHashMap<>();
        indexes.put(EduHubSchemas.USERS, List.of(
                new Index().on("email", Sort.Direction.ASC).unique(),
                new Index().on("role", Sort.Direction.ASC)));
        indexes.put(EduHubSchemas.COURSES, List.of(
                new Index().on("title", Sort.Direction.ASC),
                new Index().on("category", Sort.Direction.ASC),
                new Index().on("tags", Sort.Direction.ASC)));
        indexes.put(EduHubSchemas.ENROLLMENTS, List.of(
                new Index().on("studentId", Sort.Direction.ASC).on("courseId", Sort.Direction.ASC).unique()));
        return indexes;
    }

    private void createCollection(String name) {
        log.info("Creating collection: {}", name);
        try {
            mongoTemplate.createCollection(name);
        } catch (DataAccessException e) {
            if (StoreErrors.serverCode(e) != StoreErrors.NAMESPACE_EXISTS) throw e;
            log.debug("Collection {} was created concurrently", name);
        }
    }
}
