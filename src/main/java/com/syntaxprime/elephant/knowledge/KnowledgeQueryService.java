package com.syntaxprime.elephant.knowledge;

import com.syntaxprime.elephant.cache.ResultCache;
import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.exception.NotFoundException;
import com.syntaxprime.elephant.exception.ValidationException;
import com.syntaxprime.elephant.knowledge.personality.PersonalityRegistry;
import com.syntaxprime.elephant.knowledge.personality.PersonalityScorer;
import com.syntaxprime.elephant.model.ConversationMessage;
import com.syntaxprime.elephant.model.KnowledgeEntry;
import com.syntaxprime.elephant.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Ranks the knowledge corpus against a query, the recent conversation and a personality profile.
 *
 * <p>Pipeline: context keyword extraction, query augmentation, full-text candidate retrieval
 * (with a literal-match fallback for thin result sets), multi-signal scoring, threshold and
 * truncation, then best-effort access bookkeeping. Ranked candidate lists are cached per
 * (query, personality, limit); a cache hit skips retrieval, scoring and bookkeeping.</p>
 *
 * <p>Store failures degrade to an empty result instead of failing the caller.</p>
 */
@Service
public class KnowledgeQueryService {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeQueryService.class);

    static final Comparator<RankedEntry> BY_SCORE = Comparator
            .comparingDouble(RankedEntry::finalScore).reversed()
            .thenComparing(RankedEntry::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private final KnowledgeStore knowledgeStore;
    private final ContextKeywordExtractor keywordExtractor;
    private final KnowledgeScorer scorer;
    private final PersonalityRegistry personalities;
    private final ResultCache<SearchKey, List<RankedEntry>> searchCache;
    private final ElephantProperties.Knowledge config;

    public KnowledgeQueryService(KnowledgeStore knowledgeStore,
                                 ContextKeywordExtractor keywordExtractor,
                                 KnowledgeScorer scorer,
                                 PersonalityRegistry personalities,
                                 @Qualifier("knowledgeSearchCache") ResultCache<SearchKey, List<RankedEntry>> searchCache,
                                 ElephantProperties properties) {
        this.knowledgeStore = knowledgeStore;
        this.keywordExtractor = keywordExtractor;
        this.scorer = scorer;
        this.personalities = personalities;
        this.searchCache = searchCache;
        this.config = properties.getKnowledge();
    }

    public List<RankedEntry> search(String query, String personalityId) {
        return this.search(query, List.of(), personalityId, this.config.getDefaultLimit(), this.config.getDefaultMinRelevance());
    }

    public List<RankedEntry> search(String query, List<ConversationMessage> context, String personalityId,
                                    int limit, double minRelevance) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query must not be blank");
        }
        requirePositive(limit);
        if (Double.isNaN(minRelevance)) {
            throw new ValidationException("minRelevance must be a number");
        }
        PersonalityScorer personality = this.personalities.require(personalityId);

        SearchKey key = new SearchKey(query, personality.id(), limit);
        List<RankedEntry> cached = this.searchCache.get(key).orElse(null);
        if (cached != null) {
            if (log.isDebugEnabled()) {
                log.debug("Knowledge cache hit for query {}", LogSanitizer.querySummary(query));
            }
            return select(cached, minRelevance, limit);
        }

        List<String> contextKeywords = this.keywordExtractor.extract(context);
        AugmentedQuery augmented = AugmentedQuery.of(query, contextKeywords);
        Retrieval retrieval = this.retrieve(augmented, candidateLimit(limit, this.config.getCandidateMultiplier()));

        List<RankedEntry> ranked = new ArrayList<>(retrieval.candidates().size());
        for (KnowledgeCandidate candidate : retrieval.candidates()) {
            ranked.add(this.scorer.score(candidate, query, contextKeywords, personality));
        }
        ranked.sort(BY_SCORE);
        List<RankedEntry> rankedView = List.copyOf(ranked);

        List<RankedEntry> results = select(rankedView, minRelevance, limit);
        this.recordAccess(results);
        if (!retrieval.degraded()) {
            this.searchCache.put(key, rankedView);
        }
        log.info("Knowledge search {}: {} results from {} candidates (personality: {})",
                LogSanitizer.querySummary(query), results.size(), rankedView.size(), personality.id());
        return results;
    }

    /**
     * Entries of the same content type that share the anchor's project or key topics, ordered by
     * project match (2), topic overlap (1) plus stored relevance, then popularity.
     */
    public List<KnowledgeEntry> getRelated(String entryId, int limit) {
        if (entryId == null || entryId.isBlank()) {
            throw new ValidationException("Entry id is required");
        }
        requirePositive(limit);
        KnowledgeEntry anchor = this.knowledgeStore.findEntry(entryId)
                .orElseThrow(() -> NotFoundException.entry(entryId));

        List<KnowledgeEntry> candidates;
        try {
            candidates = this.knowledgeStore.findRelated(anchor, Math.max(candidateLimit(limit, 5), 50));
        } catch (RuntimeException e) {
            log.error("Related entry lookup failed for {}: {}", LogSanitizer.sanitize(entryId), e.getMessage());
            return List.of();
        }
        Set<String> anchorTopics = new HashSet<>(anchor.getKeyTopics());
        Comparator<KnowledgeEntry> order = Comparator
                .comparingDouble((KnowledgeEntry e) -> relatedScore(anchor, anchorTopics, e)).reversed()
                .thenComparing(Comparator.comparingLong(KnowledgeEntry::getAccessCount).reversed())
                .thenComparing(KnowledgeEntry::getId, Comparator.nullsLast(Comparator.naturalOrder()));
        return candidates.stream()
                .filter(e -> !entryId.equals(e.getId()))
                .sorted(order)
                .limit(limit)
                .toList();
    }

    /**
     * Proactive suggestions derived from the conversation alone. Uses a lower relevance floor than
     * {@link #search}, then keeps only substantial, clearly relevant entries.
     */
    public List<RankedEntry> suggestForContext(List<ConversationMessage> context, String personalityId, int limit) {
        requirePositive(limit);
        this.personalities.require(personalityId);
        if (context == null || context.isEmpty()) {
            return List.of();
        }
        List<String> keywords = this.keywordExtractor.extract(context);
        if (keywords.isEmpty()) {
            return List.of();
        }
        String derivedQuery = String.join(" ", keywords.subList(0, Math.min(3, keywords.size())));
        List<RankedEntry> suggestions = this.search(derivedQuery, context, personalityId, limit,
                this.config.getSuggestionMinRelevance());
        return suggestions.stream()
                .filter(r -> r.entry().getWordCount() > this.config.getSuggestionMinWords())
                .filter(r -> r.finalScore() > this.config.getSuggestionMinScore())
                .limit(limit)
                .toList();
    }

    public void clearCache() {
        this.searchCache.clear();
        log.info("Knowledge query cache cleared");
    }

    public long cleanupCache() {
        long removed = this.searchCache.cleanup();
        if (removed > 0) {
            log.info("Cleaned up {} expired knowledge cache entries", removed);
        }
        return removed;
    }

    public ResultCache.CacheStats cacheStats() {
        return this.searchCache.stats();
    }

    private Retrieval retrieve(AugmentedQuery query, int candidateLimit) {
        Map<String, KnowledgeCandidate> merged = new LinkedHashMap<>();
        boolean degraded = false;
        try {
            for (KnowledgeCandidate candidate : this.knowledgeStore.fullTextSearch(query, candidateLimit)) {
                merged.putIfAbsent(candidate.id(), candidate);
            }
        } catch (RuntimeException e) {
            log.error("Full-text knowledge search failed for {}: {}", LogSanitizer.querySummary(query.text()), e.getMessage());
            degraded = true;
        }
        if (merged.size() < this.config.getFallbackThreshold()) {
            if (log.isDebugEnabled()) {
                log.debug("Full-text returned {} candidates, adding pattern matches", merged.size());
            }
            try {
                for (KnowledgeCandidate candidate : this.knowledgeStore.patternSearch(query.text(), candidateLimit)) {
                    merged.putIfAbsent(candidate.id(), candidate);
                }
            } catch (RuntimeException e) {
                log.error("Pattern knowledge search failed for {}: {}", LogSanitizer.querySummary(query.text()), e.getMessage());
                degraded = true;
            }
        }
        List<KnowledgeCandidate> candidates = merged.values().stream()
                .filter(c -> c.id() != null)
                .toList();
        return new Retrieval(candidates, degraded);
    }

    private void recordAccess(List<RankedEntry> results) {
        if (results.isEmpty()) {
            return;
        }
        List<String> ids = results.stream().map(RankedEntry::id).filter(Objects::nonNull).toList();
        try {
            this.knowledgeStore.recordAccess(ids);
        } catch (RuntimeException e) {
            log.warn("Failed to update access counts for {} entries: {}", ids.size(), e.getMessage());
        }
    }

    static List<RankedEntry> select(List<RankedEntry> ranked, double minRelevance, int limit) {
        return ranked.stream()
                .filter(r -> r.finalScore() >= minRelevance)
                .limit(limit)
                .toList();
    }

    /**
     * Over-fetch size, saturating at {@link Integer#MAX_VALUE} instead of wrapping negative.
     */
    static int candidateLimit(int limit, int multiplier) {
        return (int) Math.min(Integer.MAX_VALUE, (long) limit * Math.max(1, multiplier));
    }

    private static double relatedScore(KnowledgeEntry anchor, Set<String> anchorTopics, KnowledgeEntry candidate) {
        double score = candidate.getRelevanceScore();
        if (anchor.getProjectId() != null && anchor.getProjectId().equals(candidate.getProjectId())) {
            score += 2.0;
        }
        if (candidate.getKeyTopics().stream().anyMatch(anchorTopics::contains)) {
            score += 1.0;
        }
        return score;
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be positive, got " + limit);
        }
    }

    public record SearchKey(String query, String personalityId, int limit) {
    }

    private record Retrieval(List<KnowledgeCandidate> candidates, boolean degraded) {
    }
}
