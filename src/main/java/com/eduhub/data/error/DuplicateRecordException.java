package com.eduhub.data.error;

public class DuplicateRecordException extends EduHubDataException {
    public DuplicateRecordException(String message) {
        super(message);
    }

    public DuplicateRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
