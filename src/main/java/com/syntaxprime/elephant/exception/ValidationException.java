package com.syntaxprime.elephant.exception;

public class ValidationException extends ElephantException {

    public ValidationException(String message) {
        super(message);
    }
}
