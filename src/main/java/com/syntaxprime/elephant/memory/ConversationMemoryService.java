package com.syntaxprime.elephant.memory;

import com.syntaxprime.elephant.cache.ResultCache;
import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.exception.NotFoundException;
import com.syntaxprime.elephant.exception.ValidationException;
import com.syntaxprime.elephant.model.ConversationMessage;
import com.syntaxprime.elephant.model.ConversationThread;
import com.syntaxprime.elephant.model.MessageMetadata;
import com.syntaxprime.elephant.model.MessageRole;
import com.syntaxprime.elephant.model.ThreadStatus;
import com.syntaxprime.elephant.util.LogSanitizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Conversation memory: the durable per-thread message log and the token-bounded context
 * window built from it.
 *
 * Features:
 * - Threads with generated titles that give way to the opening user message
 * - Atomic message append (count, activity and title updated with the insert)
 * - Cached history views, invalidated by appends to the same thread
 * - Context assembly newest-first under an estimated token budget
 */
@Service
public class ConversationMemoryService {
    private static final Logger log = LoggerFactory.getLogger(ConversationMemoryService.class);
    private static final String DEFAULT_PLATFORM = "web";
    private static final int DEFAULT_THREAD_LIST_LIMIT = 50;

    private final ConversationStore conversationStore;
    private final ResultCache<HistoryKey, List<ConversationMessage>> historyCache;
    private final TokenEstimator tokenEstimator;
    private final int defaultTokenBudget;

    // Guards history cache writes against appends; see cacheHistory
    private final Object historyLock = new Object();
    private long historyEpoch;

    public ConversationMemoryService(ConversationStore conversationStore,
                                     @Qualifier("historyCache") ResultCache<HistoryKey, List<ConversationMessage>> historyCache,
                                     TokenEstimator tokenEstimator,
                                     ElephantProperties properties) {
        this.conversationStore = conversationStore;
        this.historyCache = historyCache;
        this.tokenEstimator = tokenEstimator;
        this.defaultTokenBudget = properties.getMemory().getDefaultTokenBudget();
    }

    public String createThread(String ownerId, String platform) {
        return this.createThread(ownerId, platform, null, null);
    }

    /**
     * Creates an active, empty thread. Without a title the thread gets a timestamp placeholder
     * that the first user message replaces.
     */
    public String createThread(String ownerId, String platform, String title, String projectId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner id is required");
        }
        Instant now = Instant.now();
        String threadId = UUID.randomUUID().toString();
        String effectiveTitle = title == null || title.isBlank() ? ThreadTitles.placeholder(now) : title;
        String effectivePlatform = platform == null || platform.isBlank() ? DEFAULT_PLATFORM : platform;
        this.conversationStore.insertThread(
                new ConversationThread(threadId, ownerId, effectiveTitle, effectivePlatform, projectId, now));
        log.info("Created conversation thread {} on {}", threadId, LogSanitizer.sanitize(effectivePlatform));
        return threadId;
    }

    public String appendMessage(String threadId, MessageRole role, String content) {
        return this.appendMessage(threadId, role, content, null, null);
    }

    /**
     * Appends an immutable message. The thread's count and activity timestamps, and for user
     * messages a still-generic title, are updated atomically with the insert.
     *
     * @throws NotFoundException if the thread does not exist; nothing is written in that case
     */
    public String appendMessage(String threadId, MessageRole role, String content, String contentType,
                                MessageMetadata metadata) {
        requireThreadId(threadId);
        if (role == null) {
            throw new ValidationException("Message role is required");
        }
        if (content == null) {
            throw new ValidationException("Message content is required");
        }
        String retitleTo = role == MessageRole.USER ? ThreadTitles.fromContent(content) : null;
        MessageDraft draft = new MessageDraft(threadId, role, content,
                contentType == null ? ConversationMessage.DEFAULT_CONTENT_TYPE : contentType, metadata, retitleTo);

        AppendResult result;
        try {
            result = this.conversationStore.append(draft);
        } finally {
            // A failed append may still have committed
            this.invalidateHistory(threadId);
        }
        if (result.retitled()) {
            log.info("Updated thread {} title from first user message", threadId);
        }
        log.info("Added {} message to thread {}: {}", role.wireName(), threadId, result.message().id());
        return result.message().id();
    }

    public List<ConversationMessage> getHistory(String threadId) {
        return this.getHistory(threadId, null, false);
    }

    /**
     * Messages in creation order. {@code limit} keeps the first {@code limit} messages; without
     * metadata, content type and generation metadata are left out of the returned views.
     */
    public List<ConversationMessage> getHistory(String threadId, Integer limit, boolean includeMetadata) {
        requireThreadId(threadId);
        if (limit != null && limit <= 0) {
            throw new ValidationException("limit must be positive, got " + limit);
        }
        HistoryKey key = new HistoryKey(threadId, limit, includeMetadata);
        List<ConversationMessage> cached = this.historyCache.get(key).orElse(null);
        if (cached != null) {
            return cached;
        }

        long epoch;
        synchronized (this.historyLock) {
            epoch = this.historyEpoch;
        }
        this.conversationStore.findThread(threadId).orElseThrow(() -> NotFoundException.thread(threadId));
        List<ConversationMessage> messages = this.conversationStore.findMessages(threadId, limit);
        List<ConversationMessage> view = includeMetadata
                ? List.copyOf(messages)
                : messages.stream().map(ConversationMessage::withoutMetadata).toList();
        this.cacheHistory(key, view, epoch);
        return view;
    }

    /**
     * Walks the history newest to oldest, keeping messages while their estimated cost fits the
     * budget, and stops at the first one that does not. The kept messages are a suffix of the
     * history, returned oldest first. A most recent message that alone exceeds the budget yields
     * an empty window.
     *
     * @param tokenBudget budget in estimated tokens; null uses the configured default
     */
    public ContextWindow assembleContext(String threadId, Integer tokenBudget) {
        int budget = tokenBudget == null ? this.defaultTokenBudget : tokenBudget;
        if (budget < 0) {
            throw new ValidationException("tokenBudget must not be negative, got " + budget);
        }
        List<ConversationMessage> history = this.getHistory(threadId, null, true);

        List<ConversationMessage> selected = new ArrayList<>();
        long totalTokens = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationMessage message = history.get(i);
            int cost = this.tokenEstimator.estimate(message.content());
            if (totalTokens + cost > budget) {
                break;
            }
            selected.add(message);
            totalTokens += cost;
        }
        Collections.reverse(selected);

        if (log.isDebugEnabled()) {
            log.debug("Assembled context for thread {}: {}/{} messages, ~{} of {} tokens",
                    threadId, selected.size(), history.size(), totalTokens, budget);
        }
        return new ContextWindow(List.copyOf(selected),
                new ContextWindow.Stats(threadId, selected.size(), totalTokens, budget));
    }

    public ConversationThread getThread(String threadId) {
        requireThreadId(threadId);
        return this.conversationStore.findThread(threadId).orElseThrow(() -> NotFoundException.thread(threadId));
    }

    public List<ConversationThread> listThreads(String ownerId) {
        return this.listThreads(ownerId, ThreadStatus.ACTIVE, DEFAULT_THREAD_LIST_LIMIT);
    }

    public List<ConversationThread> listThreads(String ownerId, ThreadStatus status, int limit) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner id is required");
        }
        if (limit <= 0) {
            throw new ValidationException("limit must be positive, got " + limit);
        }
        return this.conversationStore.findThreads(ownerId, status == null ? ThreadStatus.ACTIVE : status, limit);
    }

    public void clearCache() {
        this.historyCache.clear();
        log.debug("Cleared conversation history cache");
    }

    public ResultCache.CacheStats cacheStats() {
        return this.historyCache.stats();
    }

    /**
     * Stores a freshly read view unless an append happened since the read began. Appends bump the
     * epoch and invalidate under the same lock, so a stale view can never be cached after its
     * thread's invalidation ran.
     */
    private void cacheHistory(HistoryKey key, List<ConversationMessage> view, long readEpoch) {
        synchronized (this.historyLock) {
            if (this.historyEpoch == readEpoch) {
                this.historyCache.put(key, view);
            }
        }
    }

    private void invalidateHistory(String threadId) {
        synchronized (this.historyLock) {
            this.historyEpoch++;
            this.historyCache.invalidateIf(key -> key.threadId().equals(threadId));
        }
    }

    private static void requireThreadId(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            throw new ValidationException("Thread id is required");
        }
    }
}
