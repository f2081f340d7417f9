package com.syntaxprime.elephant.knowledge;

import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.exception.StoreErrors;
import com.syntaxprime.elephant.model.KnowledgeEntry;
import com.syntaxprime.elephant.model.KnowledgeProject;
import com.syntaxprime.elephant.model.KnowledgeSource;
import com.syntaxprime.elephant.util.LogSanitizer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.core.query.TextQuery;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

@Repository
public class MongoKnowledgeStore implements KnowledgeStore {
    private static final Logger log = LoggerFactory.getLogger(MongoKnowledgeStore.class);

    private static final String PROCESSED = "processed";
    private static final Pattern PHRASE_QUOTE = Pattern.compile("\"");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final MongoTemplate mongoTemplate;
    private final Duration maxTime;

    public MongoKnowledgeStore(MongoTemplate mongoTemplate, ElephantProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.maxTime = properties.getStore().getMaxTime();
    }

    @Override
    public List<KnowledgeCandidate> fullTextSearch(AugmentedQuery query, int limit) {
        String terms = plainTerms(query.text());
        List<String> contextTerms = query.contextTerms().stream()
                .map(MongoKnowledgeStore::plainTerms)
                .filter(term -> !term.isEmpty())
                .toList();
        if (terms.isEmpty() && contextTerms.isEmpty()) {
            return List.of();
        }
        TextCriteria criteria = TextCriteria.forDefaultLanguage();
        if (!terms.isEmpty()) {
            criteria.matching(terms);
        }
        if (!contextTerms.isEmpty()) {
            criteria.matchingAny(contextTerms.toArray(new String[0]));
        }
        Query textQuery = TextQuery.queryText(criteria)
                .sortByScore()
                .addCriteria(Criteria.where(PROCESSED).is(true))
                .with(Sort.by(Sort.Direction.DESC, "relevanceScore", "accessCount"))
                .limit(limit)
                .maxTime(this.maxTime);
        try {
            List<KnowledgeEntry> entries = this.mongoTemplate.find(textQuery, KnowledgeEntry.class);
            if (log.isDebugEnabled()) {
                log.debug("Full-text query {} returned {} entries", LogSanitizer.querySummary(query.render()), entries.size());
            }
            return this.toCandidates(entries, entry -> entry.getTextScore() == null ? 0.0 : entry.getTextScore().doubleValue());
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Full-text search", e);
        }
    }

    @Override
    public List<KnowledgeCandidate> patternSearch(String query, int limit) {
        Pattern literal = Pattern.compile(Pattern.quote(query.strip()), Pattern.CASE_INSENSITIVE);
        Query patternQuery = new Query(new Criteria().andOperator(
                Criteria.where(PROCESSED).is(true),
                new Criteria().orOperator(
                        Criteria.where("title").regex(literal),
                        Criteria.where("content").regex(literal))))
                .with(Sort.by(Sort.Direction.DESC, "accessCount", "relevanceScore"))
                .limit(limit)
                .maxTime(this.maxTime);
        try {
            List<KnowledgeEntry> entries = this.mongoTemplate.find(patternQuery, KnowledgeEntry.class);
            List<KnowledgeCandidate> candidates = new ArrayList<>(this.toCandidates(entries, entry -> patternRank(entry, query)));
            candidates.sort(Comparator.comparingDouble(KnowledgeCandidate::nativeRank).reversed());
            return candidates;
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Pattern search", e);
        }
    }

    @Override
    public Optional<KnowledgeEntry> findEntry(String entryId) {
        try {
            Query query = new Query(Criteria.where("_id").is(entryId)).maxTime(this.maxTime);
            return Optional.ofNullable(this.mongoTemplate.findOne(query, KnowledgeEntry.class));
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Knowledge entry lookup", e);
        }
    }

    @Override
    public List<KnowledgeEntry> findRelated(KnowledgeEntry anchor, int limit) {
        List<Criteria> shared = new ArrayList<>();
        if (anchor.getProjectId() != null) {
            shared.add(Criteria.where("projectId").is(anchor.getProjectId()));
        }
        if (!anchor.getKeyTopics().isEmpty()) {
            shared.add(Criteria.where("keyTopics").in(anchor.getKeyTopics()));
        }
        if (shared.isEmpty()) {
            return List.of();
        }
        Criteria criteria = new Criteria().andOperator(
                Criteria.where("_id").ne(anchor.getId()),
                Criteria.where(PROCESSED).is(true),
                Criteria.where("contentType").is(anchor.getContentType()),
                new Criteria().orOperator(shared));
        Query query = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "relevanceScore", "accessCount"))
                .limit(limit)
                .maxTime(this.maxTime);
        try {
            return this.mongoTemplate.find(query, KnowledgeEntry.class);
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Related entry lookup", e);
        }
    }

    @Override
    public void recordAccess(Collection<String> entryIds) {
        if (entryIds == null || entryIds.isEmpty()) {
            return;
        }
        Query query = new Query(Criteria.where("_id").in(entryIds)).maxTime(this.maxTime);
        Update update = new Update()
                .inc("accessCount", 1)
                .set("lastAccessed", Instant.now());
        try {
            this.mongoTemplate.updateMulti(query, update, KnowledgeEntry.class);
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Access count update", e);
        }
    }

    /**
     * Query text as plain search terms. {@code $text} reads a quote as a phrase delimiter and a
     * leading hyphen as negation; both are dropped so every term counts positively.
     */
    static String plainTerms(String text) {
        if (text == null) {
            return "";
        }
        List<String> terms = new ArrayList<>();
        for (String token : WHITESPACE.split(PHRASE_QUOTE.matcher(text).replaceAll(" ").strip())) {
            String term = token.replaceFirst("^-+", "");
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return String.join(" ", terms);
    }

    /**
     * Title hits rank highest, then body hits by how early they occur.
     */
    static double patternRank(KnowledgeEntry entry, String query) {
        String needle = query.strip().toLowerCase(Locale.ROOT);
        String title = entry.getTitle() == null ? "" : entry.getTitle().toLowerCase(Locale.ROOT);
        if (title.contains(needle)) {
            return 1.0;
        }
        String content = entry.getContent() == null ? "" : entry.getContent().toLowerCase(Locale.ROOT);
        int position = content.indexOf(needle);
        if (position < 0) {
            return 0.3;
        }
        if (position < 500) {
            return 0.8;
        }
        if (position < 2000) {
            return 0.6;
        }
        if (position < 5000) {
            return 0.4;
        }
        return 0.3;
    }

    private List<KnowledgeCandidate> toCandidates(List<KnowledgeEntry> entries, Function<KnowledgeEntry, Double> rank) {
        if (entries.isEmpty()) {
            return List.of();
        }
        Map<String, KnowledgeSource> sources = this.lookup(
                entries.stream().map(KnowledgeEntry::getSourceId), KnowledgeSource.class, KnowledgeSource::id);
        Map<String, KnowledgeProject> projects = this.lookup(
                entries.stream().map(KnowledgeEntry::getProjectId), KnowledgeProject.class, KnowledgeProject::id);
        List<KnowledgeCandidate> candidates = new ArrayList<>(entries.size());
        for (KnowledgeEntry entry : entries) {
            KnowledgeSource source = entry.getSourceId() == null ? null : sources.get(entry.getSourceId());
            KnowledgeProject project = entry.getProjectId() == null ? null : projects.get(entry.getProjectId());
            candidates.add(new KnowledgeCandidate(
                    entry,
                    source == null ? null : source.sourceType(),
                    project == null ? null : project.name(),
                    project == null ? null : project.category(),
                    rank.apply(entry)));
        }
        return candidates;
    }

    private <T> Map<String, T> lookup(Stream<String> ids, Class<T> type, Function<T, String> idOf) {
        Set<String> wanted = ids.filter(Objects::nonNull).collect(Collectors.toCollection(LinkedHashSet::new));
        if (wanted.isEmpty()) {
            return Map.of();
        }
        Query query = new Query(Criteria.where("_id").in(wanted)).maxTime(this.maxTime);
        Map<String, T> byId = new HashMap<>();
        for (T item : this.mongoTemplate.find(query, type)) {
            byId.put(idOf.apply(item), item);
        }
        return byId;
    }
}
