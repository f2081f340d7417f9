package com.syntaxprime.elephant.model;

import java.time.Instant;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A single immutable message. {@code sequence} is the thread's message count right after this
 * message was appended; it is assigned atomically and defines creation order within the thread.
 */
@Document(collection = ConversationMessage.COLLECTION)
public record ConversationMessage(
        String id,
        String threadId,
        long sequence,
        MessageRole role,
        String content,
        String contentType,
        MessageMetadata metadata,
        Instant createdAt
) {
    public static final String COLLECTION = "conversation_messages";
    public static final String DEFAULT_CONTENT_TYPE = "text";

    /**
     * Copy without content type and generation metadata, the view returned when metadata is not requested.
     */
    public ConversationMessage withoutMetadata() {
        return new ConversationMessage(id, threadId, sequence, role, content, null, null, createdAt);
    }
}
