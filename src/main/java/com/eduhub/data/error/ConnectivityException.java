package com.eduhub.data.error;

public class ConnectivityException extends EduHubDataException {
    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
