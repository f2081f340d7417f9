package com.syntaxprime.elephant.model;

import com.syntaxprime.elephant.exception.ValidationException;
import java.util.Locale;

public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    MessageRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static MessageRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Message role is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MessageRole role : values()) {
            if (role.wireName.equals(normalized)) {
                return role;
            }
        }
        throw new ValidationException("Unknown message role: " + value);
    }
}
