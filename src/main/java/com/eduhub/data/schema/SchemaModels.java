package com.eduhub.data.schema;

import org.bson.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SchemaModels {
    public enum FieldKind {
        STRING("string"),
        BOOL("bool"),
        DATE("date"),
        OBJECT_ID("objectId"),
        NUMBER("number"),
        STRING_ARRAY("array");

        private final String bsonType;

        FieldKind(String bsonType) {
            this.bsonType = bsonType;
        }

        public String bsonType() {
            return bsonType;
        }
    }

    public record FieldConstraints(List<String> allowedValues, String pattern, Double minimum) {
        public static final FieldConstraints NONE = new FieldConstraints(List.of(), null, null);

        public static FieldConstraints oneOf(String... values) {
            return new FieldConstraints(List.of(values), null, null);
        }

        public static FieldConstraints matching(String pattern) {
            return new FieldConstraints(List.of(), pattern, null);
        }

        public static FieldConstraints atLeast(double minimum) {
            return new FieldConstraints(List.of(), null, minimum);
        }
    }

    public record FieldRule(String name, boolean required, FieldKind kind, FieldConstraints constraints) {
        public static FieldRule required(String name, FieldKind kind) {
            return new FieldRule(name, true, kind, FieldConstraints.NONE);
        }

        public static FieldRule required(String name, FieldKind kind, FieldConstraints constraints) {
            return new FieldRule(name, true, kind, constraints);
        }

        public static FieldRule optional(String name, FieldKind kind) {
            return new FieldRule(name, false, kind, FieldConstraints.NONE);
        }

        Document toProperty() {
            Document property = new Document("bsonType", kind.bsonType());
            if (kind == FieldKind.STRING_ARRAY) {
                property.append("items", new Document("bsonType", FieldKind.STRING.bsonType()));
            }
            if (!constraints.allowedValues().isEmpty()) {
                property.append("enum", constraints.allowedValues());
            }
            if (constraints.pattern() != null) {
                property.append("pattern", constraints.pattern());
            }
            if (constraints.minimum() != null) {
                property.append("minimum", constraints.minimum());
            }
            return property;
        }
    }

    public record CollectionSchema(String collection, List<FieldRule> fields) {
        public List<String> requiredFields() {
            return fields.stream().filter(FieldRule::required).map(FieldRule::name).toList();
        }

        public Document toValidator() {
            Map<String, Object> properties = new LinkedHashMap<>();
            fields.forEach(f -> properties.put(f.name(), f.toProperty()));
            Document jsonSchema = new Document("bsonType", "object")
                    .append("required", new ArrayList<>(requiredFields()))
                    .append("properties", new Document(properties));
            return new Document("$jsonSchema", jsonSchema);
        }
    }
}
