package com.syntaxprime.elephant.model;

import java.util.List;
import java.util.Map;

/**
 * Generation metadata attached to a message. Opaque to ranking and context assembly.
 */
public record MessageMetadata(
        String modelUsed,
        Long responseTimeMs,
        List<String> knowledgeSourcesUsed,
        Map<String, Object> extractedPreferences,
        Map<String, Object> attributes
) {
    public MessageMetadata {
        knowledgeSourcesUsed = knowledgeSourcesUsed == null ? List.of() : List.copyOf(knowledgeSourcesUsed);
        extractedPreferences = extractedPreferences == null ? Map.of() : Map.copyOf(extractedPreferences);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static MessageMetadata forAssistant(String modelUsed, long responseTimeMs, List<String> knowledgeSourcesUsed) {
        return new MessageMetadata(modelUsed, responseTimeMs, knowledgeSourcesUsed, Map.of(), Map.of());
    }
}
