package com.eduhub.data.error;

import com.mongodb.MongoServerException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

public final class StoreErrors {
    public static final int NAMESPACE_EXISTS = 48;
    public static final int INDEX_OPTIONS_CONFLICT = 85;
    public static final int INDEX_KEY_SPECS_CONFLICT = 86;
    public static final int DOCUMENT_VALIDATION_FAILURE = 121;
    public static final int DUPLICATE_KEY = 11000;

    private StoreErrors() {}

    public static RuntimeException onWrite(String collection, DataAccessException e) {
        if (isUnreachable(e)) {
            return new ConnectivityException("Cannot reach store while writing to " + collection, e);
        }
        if (e instanceof DuplicateKeyException || serverCode(e) == DUPLICATE_KEY) {
            return new DuplicateRecordException("Duplicate key in " + collection + ": " + e.getMostSpecificCause().getMessage(), e);
        }
        if (serverCode(e) == DOCUMENT_VALIDATION_FAILURE) {
            return new ValidationException("Document failed validation for " + collection, e);
        }
        return e;
    }

    public static RuntimeException onRead(String collection, DataAccessException e) {
        if (isUnreachable(e)) {
            return new ConnectivityException("Cannot reach store while reading " + collection, e);
        }
        return e;
    }

    public static RuntimeException onSchema(String collection, DataAccessException e) {
        if (isUnreachable(e)) {
            return new ConnectivityException("Cannot reach store while configuring " + collection, e);
        }
        return new SchemaApplicationException("Validator rejected for " + collection + ": " + e.getMostSpecificCause().getMessage(), e);
    }

    public static RuntimeException onIndex(String collection, DataAccessException e) {
        if (isUnreachable(e)) {
            return new ConnectivityException("Cannot reach store while indexing " + collection, e);
        }
        int code = serverCode(e);
        if (e instanceof DuplicateKeyException || code == DUPLICATE_KEY
                || code == INDEX_OPTIONS_CONFLICT || code == INDEX_KEY_SPECS_CONFLICT) {
            return new IndexConflictException("Index conflict on " + collection + ": " + e.getMostSpecificCause().getMessage(), e);
        }
        return e;
    }

    public static RuntimeException onAggregation(String collection, DataAccessException e) {
        if (isUnreachable(e)) {
            return new ConnectivityException("Cannot reach store while aggregating " + collection, e);
        }
        return new AggregationException("Aggregation over " + collection + " rejected: " + e.getMostSpecificCause().getMessage(), e);
    }

    public static int serverCode(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof MongoServerException) {
                return ((MongoServerException) t).getCode();
            }
            if (t.getCause() == t) break;
        }
        return -1;
    }

    static boolean isUnreachable(Throwable e) {
        if (e instanceof DataAccessResourceFailureException) return true;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof MongoSocketException || t instanceof MongoTimeoutException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }
}
