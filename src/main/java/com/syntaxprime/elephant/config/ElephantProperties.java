package com.syntaxprime.elephant.config;

import com.syntaxprime.elephant.knowledge.personality.PersonalityRule;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "elephant")
public class ElephantProperties {
    private final Memory memory = new Memory();
    private final Knowledge knowledge = new Knowledge();
    private final Store store = new Store();

    public Memory getMemory() {
        return memory;
    }

    public Knowledge getKnowledge() {
        return knowledge;
    }

    public Store getStore() {
        return store;
    }

    public static class Memory {
        /**
         * Token budget used when a caller assembles context without one.
         */
        private int defaultTokenBudget = 250_000;

        /**
         * Upper bound on cached history views across all threads. History views have no TTL;
         * appends invalidate them.
         */
        private long historyCacheMaxEntries = 500;

        /**
         * Characters per token of the default estimator. A coarse approximation, not a tokenizer.
         */
        private int charsPerToken = 4;

        public int getDefaultTokenBudget() {
            return defaultTokenBudget;
        }

        public void setDefaultTokenBudget(int defaultTokenBudget) {
            this.defaultTokenBudget = defaultTokenBudget;
        }

        public long getHistoryCacheMaxEntries() {
            return historyCacheMaxEntries;
        }

        public void setHistoryCacheMaxEntries(long historyCacheMaxEntries) {
            this.historyCacheMaxEntries = historyCacheMaxEntries;
        }

        public int getCharsPerToken() {
            return charsPerToken;
        }

        public void setCharsPerToken(int charsPerToken) {
            this.charsPerToken = charsPerToken;
        }
    }

    public static class Knowledge {
        private Duration cacheTtl = Duration.ofHours(1);
        private long cacheMaxEntries = 200;
        private int defaultLimit = 10;
        private double defaultMinRelevance = 0.01;

        /**
         * Candidates fetched from the full-text index per requested result.
         */
        private int candidateMultiplier = 2;

        /**
         * Full-text hit counts below this trigger the literal pattern-match fallback.
         */
        private int fallbackThreshold = 3;

        private double suggestionMinRelevance = 0.05;
        private double suggestionMinScore = 0.2;
        private int suggestionMinWords = 100;

        private Map<String, Double> sourceWeights = new LinkedHashMap<>(Map.of(
                "conversation", 1.0,
                "processed", 0.9,
                "raw_data", 0.8));
        private double defaultSourceWeight = 0.5;

        /**
         * Additive boosts keyed by project name.
         */
        private Map<String, Double> projectBoosts = new LinkedHashMap<>(Map.of(
                "AMCF", 0.2,
                "Business", 0.15,
                "Health", 0.15));

        /**
         * Rule tables per personality id. The first matching rule supplies the factor; no match means 1.0.
         */
        private Map<String, Personality> personalities = defaultPersonalities();

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public long getCacheMaxEntries() {
            return cacheMaxEntries;
        }

        public void setCacheMaxEntries(long cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public double getDefaultMinRelevance() {
            return defaultMinRelevance;
        }

        public void setDefaultMinRelevance(double defaultMinRelevance) {
            this.defaultMinRelevance = defaultMinRelevance;
        }

        public int getCandidateMultiplier() {
            return candidateMultiplier;
        }

        public void setCandidateMultiplier(int candidateMultiplier) {
            this.candidateMultiplier = candidateMultiplier;
        }

        public int getFallbackThreshold() {
            return fallbackThreshold;
        }

        public void setFallbackThreshold(int fallbackThreshold) {
            this.fallbackThreshold = fallbackThreshold;
        }

        public double getSuggestionMinRelevance() {
            return suggestionMinRelevance;
        }

        public void setSuggestionMinRelevance(double suggestionMinRelevance) {
            this.suggestionMinRelevance = suggestionMinRelevance;
        }

        public double getSuggestionMinScore() {
            return suggestionMinScore;
        }

        public void setSuggestionMinScore(double suggestionMinScore) {
            this.suggestionMinScore = suggestionMinScore;
        }

        public int getSuggestionMinWords() {
            return suggestionMinWords;
        }

        public void setSuggestionMinWords(int suggestionMinWords) {
            this.suggestionMinWords = suggestionMinWords;
        }

        public Map<String, Double> getSourceWeights() {
            return sourceWeights;
        }

        public void setSourceWeights(Map<String, Double> sourceWeights) {
            this.sourceWeights = sourceWeights;
        }

        public double getDefaultSourceWeight() {
            return defaultSourceWeight;
        }

        public void setDefaultSourceWeight(double defaultSourceWeight) {
            this.defaultSourceWeight = defaultSourceWeight;
        }

        public Map<String, Double> getProjectBoosts() {
            return projectBoosts;
        }

        public void setProjectBoosts(Map<String, Double> projectBoosts) {
            this.projectBoosts = projectBoosts;
        }

        public Map<String, Personality> getPersonalities() {
            return personalities;
        }

        public void setPersonalities(Map<String, Personality> personalities) {
            this.personalities = personalities;
        }
    }

    public static class Personality {
        private List<PersonalityRule> rules = new ArrayList<>();

        public Personality() {}

        public Personality(List<PersonalityRule> rules) {
            this.rules = new ArrayList<>(rules);
        }

        public List<PersonalityRule> getRules() {
            return rules;
        }

        public void setRules(List<PersonalityRule> rules) {
            this.rules = rules;
        }
    }

    public static class Store {
        /**
         * Server-side time limit attached to every store query.
         */
        private Duration maxTime = Duration.ofSeconds(5);

        /**
         * Creates the full-text and lookup indexes at startup.
         */
        private boolean ensureIndexes = true;

        public Duration getMaxTime() {
            return maxTime;
        }

        public void setMaxTime(Duration maxTime) {
            this.maxTime = maxTime;
        }

        public boolean isEnsureIndexes() {
            return ensureIndexes;
        }

        public void setEnsureIndexes(boolean ensureIndexes) {
            this.ensureIndexes = ensureIndexes;
        }
    }

    static Map<String, Personality> defaultPersonalities() {
        Map<String, Personality> defaults = new LinkedHashMap<>();
        // Conversation history first, then client and creative work
        defaults.put("syntaxprime", new Personality(List.of(
                PersonalityRule.contentType(1.2, "conversation"),
                PersonalityRule.projectCategory(1.1, "client_work", "creative"))));
        // Structured, technical material
        defaults.put("syntaxbot", new Personality(List.of(
                PersonalityRule.sourceType(1.2, "raw_data"),
                PersonalityRule.projectCategory(1.15, "domain_knowledge"))));
        defaults.put("nilexe", new Personality(List.of(
                PersonalityRule.keyTopic(1.3, "creative"),
                PersonalityRule.contentType(1.1, "conversation"))));
        // Short, actionable entries; very long ones are penalized
        defaults.put("ggpt", new Personality(List.of(
                PersonalityRule.wordCount(1.2, 100, 1000),
                PersonalityRule.wordCount(0.8, 5001, null))));
        return defaults;
    }
}
