package com.syntaxprime.elephant.memory;

import com.syntaxprime.elephant.model.ConversationMessage;
import java.util.List;

/**
 * The most recent messages of a thread that fit a token budget, in chronological order.
 */
public record ContextWindow(List<ConversationMessage> messages, Stats stats) {

    public record Stats(String threadId, int messages, long estimatedTokens, int tokenBudget) {
    }
}
