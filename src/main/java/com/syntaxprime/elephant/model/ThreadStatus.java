package com.syntaxprime.elephant.model;

public enum ThreadStatus {
    ACTIVE,
    ARCHIVED
}
