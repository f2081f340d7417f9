package com.syntaxprime.elephant.knowledge;

import com.syntaxprime.elephant.model.KnowledgeEntry;

public record RankedEntry(
        KnowledgeEntry entry,
        String sourceType,
        String projectName,
        String projectCategory,
        String snippet,
        double finalScore,
        ScoreBreakdown scoring
) {
    public String id() {
        return entry.getId();
    }
}
