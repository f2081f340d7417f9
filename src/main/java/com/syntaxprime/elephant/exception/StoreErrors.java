package com.syntaxprime.elephant.exception;

import com.mongodb.MongoTimeoutException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Maps Spring data access and transaction failures onto the transient/permanent split callers act on.
 */
public final class StoreErrors {

    private StoreErrors() {
    }

    public static ElephantException translate(String operation, RuntimeException ex) {
        if (isTransient(ex)) {
            return new TransientStoreException(operation + " failed: store unavailable", ex);
        }
        return new PermanentStoreException(operation + " failed", ex);
    }

    public static boolean isTransient(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof TransientDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof QueryTimeoutException
                    || current instanceof MongoTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
