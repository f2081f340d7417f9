package com.syntaxprime.elephant.memory;

import com.syntaxprime.elephant.model.MessageMetadata;
import com.syntaxprime.elephant.model.MessageRole;

/**
 * A message before the store has assigned its id, sequence and timestamp.
 *
 * @param retitleTo title to apply if the thread still carries a generic one, or null
 */
public record MessageDraft(
        String threadId,
        MessageRole role,
        String content,
        String contentType,
        MessageMetadata metadata,
        String retitleTo
) {
}
