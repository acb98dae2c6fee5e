package com.eduhub.data.error;

public class IndexConflictException extends EduHubDataException {
    public IndexConflictException(String message) {
        super(message);
    }

    public IndexConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
