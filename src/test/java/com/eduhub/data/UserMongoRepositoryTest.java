package com.eduhub.data;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.DuplicateRecordException;
import com.eduhub.data.repository.UserMongoRepository;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class UserMongoRepositoryTest {
    private MongoTemplate mongoTemplate;
    private UserMongoRepository repository;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        repository = new UserMongoRepository(mongoTemplate);
    }

    @Test
    void updateSetsFieldsOnMatchingId() {
        ObjectId id = new ObjectId();
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq("users")))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("lastName", "Renamed");
        fields.put("isActive", false);

        assertEquals(1, repository.update(id.toHexString(), fields));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq("users"));
        assertEquals(new Document("_id", id), query.getValue().getQueryObject());
        assertEquals(new Document("$set", new Document("lastName", "Renamed").append("isActive", false)),
                update.getValue().getUpdateObject());
    }

    @Test
    void emptyOrUnknownTargetsSkipTheStore() {
        assertEquals(0, repository.update(new ObjectId().toHexString(), Map.of()));
        assertEquals(0, repository.update("not-an-id", Map.of("lastName", "X")));
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void insertStampsJoinDateAndActiveFlag() {
        Instant joined = Instant.parse("2026-01-15T10:00:00Z");

        repository.insert(new DomainModels.NewUser("a@b.com", "A", "B", DomainModels.UserRole.INSTRUCTOR), joined);

        ArgumentCaptor<Document> doc = ArgumentCaptor.forClass(Document.class);
        verify(mongoTemplate).insert(doc.capture(), eq("users"));
        assertEquals("instructor", doc.getValue().getString("role"));
        assertEquals(true, doc.getValue().getBoolean("isActive"));
        assertEquals(java.util.Date.from(joined), doc.getValue().get("dateJoined"));
    }

    @Test
    void duplicateEmailSurfacesAsDuplicateRecord() {
        when(mongoTemplate.insert(any(Document.class), eq("users"))).thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        assertThrows(DuplicateRecordException.class, () -> repository.insert(
                new DomainModels.NewUser("a@b.com", "A", "B", DomainModels.UserRole.STUDENT), Instant.now()));
    }
}
