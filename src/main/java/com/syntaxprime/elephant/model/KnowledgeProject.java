package com.syntaxprime.elephant.model;

import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Externally owned lookup; {@code name} selects the project boost, {@code category} feeds personality rules.
 */
@Document(collection = KnowledgeProject.COLLECTION)
public record KnowledgeProject(String id, String name, String category) {
    public static final String COLLECTION = "knowledge_projects";
}
