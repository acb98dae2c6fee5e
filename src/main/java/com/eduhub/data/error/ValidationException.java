package com.eduhub.data.error;

public class ValidationException extends EduHubDataException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
