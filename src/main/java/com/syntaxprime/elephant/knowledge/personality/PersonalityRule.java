package com.syntaxprime.elephant.knowledge.personality;

import com.syntaxprime.elephant.knowledge.KnowledgeCandidate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * One row of a personality rule table, bound from {@code elephant.knowledge.personalities.<id>.rules[n]}.
 *
 * <pre>
 * match: content-type
 * values: [conversation]
 * factor: 1.2
 * </pre>
 *
 * Word-count rules use {@code min-words}/{@code max-words} (both inclusive, either may be omitted)
 * instead of {@code values}. Key-topic rules match when any topic contains one of the values.
 */
public class PersonalityRule {

    public enum Match {
        CONTENT_TYPE,
        SOURCE_TYPE,
        PROJECT_CATEGORY,
        KEY_TOPIC,
        WORD_COUNT
    }

    private Match match;
    private List<String> values = new ArrayList<>();
    private Integer minWords;
    private Integer maxWords;
    private double factor = 1.0;

    public PersonalityRule() {}

    private PersonalityRule(Match match, double factor, List<String> values, Integer minWords, Integer maxWords) {
        this.match = match;
        this.factor = factor;
        this.values = new ArrayList<>(values);
        this.minWords = minWords;
        this.maxWords = maxWords;
    }

    public static PersonalityRule contentType(double factor, String... values) {
        return new PersonalityRule(Match.CONTENT_TYPE, factor, Arrays.asList(values), null, null);
    }

    public static PersonalityRule sourceType(double factor, String... values) {
        return new PersonalityRule(Match.SOURCE_TYPE, factor, Arrays.asList(values), null, null);
    }

    public static PersonalityRule projectCategory(double factor, String... values) {
        return new PersonalityRule(Match.PROJECT_CATEGORY, factor, Arrays.asList(values), null, null);
    }

    public static PersonalityRule keyTopic(double factor, String... values) {
        return new PersonalityRule(Match.KEY_TOPIC, factor, Arrays.asList(values), null, null);
    }

    public static PersonalityRule wordCount(double factor, Integer minWords, Integer maxWords) {
        return new PersonalityRule(Match.WORD_COUNT, factor, List.of(), minWords, maxWords);
    }

    public boolean matches(KnowledgeCandidate candidate) {
        if (this.match == null) {
            return false;
        }
        return switch (this.match) {
            case CONTENT_TYPE -> this.matchesValue(candidate.entry().getContentType());
            case SOURCE_TYPE -> this.matchesValue(candidate.sourceType());
            case PROJECT_CATEGORY -> this.matchesValue(candidate.projectCategory());
            case KEY_TOPIC -> this.matchesTopic(candidate.entry().getKeyTopics());
            case WORD_COUNT -> this.matchesWordCount(candidate.entry().getWordCount());
        };
    }

    private boolean matchesValue(String actual) {
        if (actual == null) {
            return false;
        }
        return this.values.stream().anyMatch(v -> v.equalsIgnoreCase(actual));
    }

    private boolean matchesTopic(List<String> topics) {
        for (String topic : topics) {
            if (topic == null) {
                continue;
            }
            String lower = topic.toLowerCase(Locale.ROOT);
            for (String value : this.values) {
                if (lower.contains(value.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean matchesWordCount(int wordCount) {
        if (this.minWords != null && wordCount < this.minWords) {
            return false;
        }
        return this.maxWords == null || wordCount <= this.maxWords;
    }

    public Match getMatch() {
        return match;
    }

    public void setMatch(Match match) {
        this.match = match;
    }

    public List<String> getValues() {
        return values;
    }

    public void setValues(List<String> values) {
        this.values = values == null ? new ArrayList<>() : values;
    }

    public Integer getMinWords() {
        return minWords;
    }

    public void setMinWords(Integer minWords) {
        this.minWords = minWords;
    }

    public Integer getMaxWords() {
        return maxWords;
    }

    public void setMaxWords(Integer maxWords) {
        this.maxWords = maxWords;
    }

    public double getFactor() {
        return factor;
    }

    public void setFactor(double factor) {
        this.factor = factor;
    }
}
