package com.eduhub.data.repository;

import com.eduhub.data.error.ValidationException;
import org.bson.types.ObjectId;

import java.util.Optional;

public final class Identifiers {
    private Identifiers() {}

    // a malformed id matches nothing
    public static Optional<ObjectId> parse(String id) {
        return id != null && ObjectId.isValid(id) ? Optional.of(new ObjectId(id)) : Optional.empty();
    }

    public static ObjectId require(String field, String id) {
        if (id == null || !ObjectId.isValid(id)) {
            throw new ValidationException(field + " is not a valid identifier: " + id);
        }
        return new ObjectId(id);
    }

    public static String hex(Object id) {
        return id instanceof ObjectId ? ((ObjectId) id).toHexString() : (id == null ? null : id.toString());
    }
}
