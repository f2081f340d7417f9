package com.syntaxprime.elephant.memory;

public record HistoryKey(String threadId, Integer limit, boolean includeMetadata) {
}
