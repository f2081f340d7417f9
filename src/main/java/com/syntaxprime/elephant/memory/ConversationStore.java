package com.syntaxprime.elephant.memory;

import com.syntaxprime.elephant.model.ConversationMessage;
import com.syntaxprime.elephant.model.ConversationThread;
import com.syntaxprime.elephant.model.ThreadStatus;
import java.util.List;
import java.util.Optional;

/**
 * Durable thread and message log.
 */
public interface ConversationStore {

    ConversationThread insertThread(ConversationThread thread);

    Optional<ConversationThread> findThread(String threadId);

    /**
     * Owner's threads in the given status, most recently active first.
     */
    List<ConversationThread> findThreads(String ownerId, ThreadStatus status, int limit);

    /**
     * Inserts the message and updates the owning thread's count, activity timestamps and (when
     * {@link MessageDraft#retitleTo()} is set and the stored title is still generic) its title,
     * all as one atomic unit. Nothing is written when the thread does not exist.
     *
     * @throws com.syntaxprime.elephant.exception.NotFoundException if the thread does not exist
     */
    AppendResult append(MessageDraft draft);

    /**
     * Messages in creation order (ascending sequence); {@code limit} keeps the first {@code limit}, null keeps all.
     */
    List<ConversationMessage> findMessages(String threadId, Integer limit);
}
