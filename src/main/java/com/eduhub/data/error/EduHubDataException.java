package com.eduhub.data.error;

public abstract class EduHubDataException extends RuntimeException {
    protected EduHubDataException(String message) {
        super(message);
    }

    protected EduHubDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
