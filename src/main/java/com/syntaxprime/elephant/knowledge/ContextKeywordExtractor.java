package com.syntaxprime.elephant.knowledge;

import com.syntaxprime.elephant.model.ConversationMessage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Pulls the most frequent content words out of the tail of a conversation.
 */
@Component
public class ContextKeywordExtractor {
    static final int RECENT_MESSAGES = 5;
    static final int MAX_KEYWORDS = 10;
    private static final int MIN_WORD_LENGTH = 4;
    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z]+\\b");
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "up", "about", "into", "through", "during",
            "i", "you", "he", "she", "it", "we", "they", "this", "that", "these", "those",
            "is", "are", "was", "were", "be", "been", "being", "have", "has", "had",
            "do", "does", "did", "will", "would", "could", "should", "may", "might", "can");

    /**
     * Top keywords by frequency, ties in order of first appearance. Empty for a missing or empty context.
     */
    public List<String> extract(List<ConversationMessage> context) {
        if (context == null || context.isEmpty()) {
            return List.of();
        }
        List<ConversationMessage> recent = context.subList(Math.max(0, context.size() - RECENT_MESSAGES), context.size());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ConversationMessage message : recent) {
            if (message == null || message.content() == null) {
                continue;
            }
            Matcher matcher = WORD.matcher(message.content().toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                String word = matcher.group();
                if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word)) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts keep first-appearance order
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return ranked.stream().limit(MAX_KEYWORDS).map(Map.Entry::getKey).toList();
    }
}
