package com.syntaxprime.elephant.exception;

/**
 * Store connectivity or timeout failure. Not retried here; retries belong to the caller or the driver.
 */
public class TransientStoreException extends ElephantException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
