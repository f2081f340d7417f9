package com.syntaxprime.elephant.knowledge;

import com.syntaxprime.elephant.model.KnowledgeEntry;

/**
 * An entry returned by the store for one query, joined with its source and project lookups and
 * carrying the index's own text-relevance rank.
 */
public record KnowledgeCandidate(
        KnowledgeEntry entry,
        String sourceType,
        String projectName,
        String projectCategory,
        double nativeRank
) {
    public String id() {
        return entry.getId();
    }
}
