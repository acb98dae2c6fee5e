package com.eduhub.data.error;

public class NotFoundException extends EduHubDataException {
    public NotFoundException(String message) {
        super(message);
    }
}
