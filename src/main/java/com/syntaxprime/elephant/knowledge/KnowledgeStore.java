package com.syntaxprime.elephant.knowledge;

import com.syntaxprime.elephant.model.KnowledgeEntry;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the knowledge corpus plus the one write this core performs (access bookkeeping).
 * Failures surface as {@link com.syntaxprime.elephant.exception.ElephantException} subtypes.
 */
public interface KnowledgeStore {

    /**
     * Full-text index lookup, best native rank first.
     */
    List<KnowledgeCandidate> fullTextSearch(AugmentedQuery query, int limit);

    /**
     * Case-insensitive literal match of the raw query against title and content.
     */
    List<KnowledgeCandidate> patternSearch(String query, int limit);

    Optional<KnowledgeEntry> findEntry(String entryId);

    /**
     * Entries of the anchor's content type sharing its project or any of its key topics, anchor excluded.
     */
    List<KnowledgeEntry> findRelated(KnowledgeEntry anchor, int limit);

    /**
     * Increments {@code accessCount} by one and stamps {@code lastAccessed} for each id.
     */
    void recordAccess(Collection<String> entryIds);
}
