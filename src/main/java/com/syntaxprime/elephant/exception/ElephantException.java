package com.syntaxprime.elephant.exception;

/**
 * Root of the errors surfaced by the conversation and knowledge core.
 */
public class ElephantException extends RuntimeException {

    public ElephantException(String message) {
        super(message);
    }

    public ElephantException(String message, Throwable cause) {
        super(message, cause);
    }
}
