package com.eduhub.data.error;

public class SchemaApplicationException extends EduHubDataException {
    public SchemaApplicationException(String message) {
        super(message);
    }

    public SchemaApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
