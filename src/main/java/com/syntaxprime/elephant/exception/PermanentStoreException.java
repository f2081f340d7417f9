package com.syntaxprime.elephant.exception;

public class PermanentStoreException extends ElephantException {

    public PermanentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
