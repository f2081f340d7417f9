package com.syntaxprime.elephant.memory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Generic thread titles and the rule for replacing them with the opening user message.
 */
public final class ThreadTitles {
    public static final String NEW_CONVERSATION = "New Conversation";
    public static final Pattern PLACEHOLDER = Pattern.compile("^Conversation \\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}$");
    static final int MAX_TITLE_LENGTH = 50;
    private static final DateTimeFormatter PLACEHOLDER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.systemDefault());

    private ThreadTitles() {
    }

    public static String placeholder(Instant at) {
        return "Conversation " + PLACEHOLDER_FORMAT.format(at);
    }

    /**
     * True for titles the system generated; anything else was set by the user and is never overwritten.
     */
    public static boolean isGeneric(String title) {
        return title != null && (NEW_CONVERSATION.equals(title) || PLACEHOLDER.matcher(title).matches());
    }

    /**
     * Title derived from message content, or null when the content has nothing to offer.
     */
    public static String fromContent(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        String stripped = content.strip();
        if (stripped.length() <= MAX_TITLE_LENGTH) {
            return stripped;
        }
        return stripped.substring(0, MAX_TITLE_LENGTH) + "...";
    }
}
