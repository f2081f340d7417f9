package com.syntaxprime.elephant.model;

import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Externally owned lookup; {@code sourceType} selects the source weight.
 */
@Document(collection = KnowledgeSource.COLLECTION)
public record KnowledgeSource(String id, String name, String sourceType) {
    public static final String COLLECTION = "knowledge_sources";
}
