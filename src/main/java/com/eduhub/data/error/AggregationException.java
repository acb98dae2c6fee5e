package com.eduhub.data.error;

public class AggregationException extends EduHubDataException {
    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
