package com.syntaxprime.elephant.memory;

import com.syntaxprime.elephant.exception.NotFoundException;
import com.syntaxprime.elephant.model.ConversationMessage;
import com.syntaxprime.elephant.model.ConversationThread;
import com.syntaxprime.elephant.model.ThreadStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Conversation store backed by maps; appends are serialized on the store monitor.
 */
public class InMemoryConversationStore implements ConversationStore {
    private final Map<String, ConversationThread> threads = new HashMap<>();
    private final Map<String, List<ConversationMessage>> messages = new HashMap<>();
    private final AtomicInteger messageReads = new AtomicInteger();

    @Override
    public synchronized ConversationThread insertThread(ConversationThread thread) {
        threads.put(thread.getId(), thread.copy());
        messages.put(thread.getId(), new ArrayList<>());
        return thread;
    }

    @Override
    public synchronized Optional<ConversationThread> findThread(String threadId) {
        ConversationThread thread = threads.get(threadId);
        return thread == null ? Optional.empty() : Optional.of(thread.copy());
    }

    @Override
    public synchronized List<ConversationThread> findThreads(String ownerId, ThreadStatus status, int limit) {
        return threads.values().stream()
                .filter(t -> t.getOwnerId().equals(ownerId) && t.getStatus() == status)
                .sorted(Comparator.comparing(ConversationThread::getLastMessageAt).reversed())
                .limit(limit)
                .map(ConversationThread::copy)
                .toList();
    }

    @Override
    public synchronized AppendResult append(MessageDraft draft) {
        ConversationThread thread = threads.get(draft.threadId());
        if (thread == null) {
            throw NotFoundException.thread(draft.threadId());
        }
        Instant now = Instant.now();
        thread.setMessageCount(thread.getMessageCount() + 1);
        thread.setLastMessageAt(now);
        thread.setUpdatedAt(now);
        ConversationMessage message = new ConversationMessage(UUID.randomUUID().toString(), draft.threadId(),
                thread.getMessageCount(), draft.role(), draft.content(), draft.contentType(), draft.metadata(), now);
        messages.get(draft.threadId()).add(message);
        boolean retitled = false;
        if (draft.retitleTo() != null && ThreadTitles.isGeneric(thread.getTitle())) {
            thread.setTitle(draft.retitleTo());
            retitled = true;
        }
        return new AppendResult(message, retitled);
    }

    @Override
    public synchronized List<ConversationMessage> findMessages(String threadId, Integer limit) {
        messageReads.incrementAndGet();
        List<ConversationMessage> all = messages.getOrDefault(threadId, List.of());
        int end = limit == null ? all.size() : Math.min(limit, all.size());
        return List.copyOf(all.subList(0, end));
    }

    public int messageReads() {
        return messageReads.get();
    }
}
