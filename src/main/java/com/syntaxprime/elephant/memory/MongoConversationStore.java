package com.syntaxprime.elephant.memory;

import com.mongodb.client.result.UpdateResult;
import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.exception.NotFoundException;
import com.syntaxprime.elephant.exception.StoreErrors;
import com.syntaxprime.elephant.model.ConversationMessage;
import com.syntaxprime.elephant.model.ConversationThread;
import com.syntaxprime.elephant.model.ThreadStatus;
import com.syntaxprime.elephant.util.LogSanitizer;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

@Repository
public class MongoConversationStore implements ConversationStore {
    private static final Logger log = LoggerFactory.getLogger(MongoConversationStore.class);

    private final MongoTemplate mongoTemplate;
    private final TransactionOperations transactions;
    private final Duration maxTime;

    public MongoConversationStore(MongoTemplate mongoTemplate,
                                  @Qualifier("conversationTransactions") TransactionOperations conversationTransactions,
                                  ElephantProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.transactions = conversationTransactions;
        this.maxTime = properties.getStore().getMaxTime();
    }

    @Override
    public ConversationThread insertThread(ConversationThread thread) {
        try {
            // Inserts take no maxTime; the transaction's commit limit bounds them
            return this.transactions.execute(status -> this.mongoTemplate.insert(thread));
        } catch (DataAccessException | TransactionException e) {
            throw StoreErrors.translate("Thread insert", e);
        }
    }

    @Override
    public Optional<ConversationThread> findThread(String threadId) {
        try {
            Query query = new Query(Criteria.where("_id").is(threadId)).maxTime(this.maxTime);
            return Optional.ofNullable(this.mongoTemplate.findOne(query, ConversationThread.class));
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Thread lookup", e);
        }
    }

    @Override
    public List<ConversationThread> findThreads(String ownerId, ThreadStatus status, int limit) {
        Query query = new Query(Criteria.where("ownerId").is(ownerId).and("status").is(status))
                .with(Sort.by(Sort.Direction.DESC, "lastMessageAt"))
                .limit(limit)
                .maxTime(this.maxTime);
        try {
            return this.mongoTemplate.find(query, ConversationThread.class);
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Thread listing", e);
        }
    }

    /**
     * Counter increment, message insert and conditional retitle run in one transaction. The
     * increment goes first so its post-image supplies the message sequence, and an unknown thread
     * aborts before anything is written. The retitle condition is evaluated by the server against
     * the current title, so a concurrent rename is never overwritten.
     */
    @Override
    public AppendResult append(MessageDraft draft) {
        try {
            return this.transactions.execute(status -> this.appendInTransaction(draft));
        } catch (DataAccessException | TransactionException e) {
            throw StoreErrors.translate("Message append", e);
        }
    }

    private AppendResult appendInTransaction(MessageDraft draft) {
        Instant now = Instant.now();
        Query byId = new Query(Criteria.where("_id").is(draft.threadId())).maxTime(this.maxTime);
        Update stats = new Update()
                .inc("messageCount", 1)
                .set("lastMessageAt", now)
                .set("updatedAt", now);
        ConversationThread thread = this.mongoTemplate.findAndModify(byId, stats,
                FindAndModifyOptions.options().returnNew(true), ConversationThread.class);
        if (thread == null) {
            throw NotFoundException.thread(draft.threadId());
        }

        ConversationMessage message = new ConversationMessage(
                UUID.randomUUID().toString(),
                draft.threadId(),
                thread.getMessageCount(),
                draft.role(),
                draft.content(),
                draft.contentType(),
                draft.metadata(),
                now);
        this.mongoTemplate.insert(message);

        boolean retitled = false;
        if (draft.retitleTo() != null) {
            Query generic = new Query(new Criteria().andOperator(
                    Criteria.where("_id").is(draft.threadId()),
                    new Criteria().orOperator(
                            Criteria.where("title").regex(ThreadTitles.PLACEHOLDER),
                            Criteria.where("title").is(ThreadTitles.NEW_CONVERSATION))))
                    .maxTime(this.maxTime);
            UpdateResult result = this.mongoTemplate.updateFirst(generic,
                    new Update().set("title", draft.retitleTo()).set("updatedAt", now), ConversationThread.class);
            retitled = result.getModifiedCount() > 0;
            if (retitled && log.isDebugEnabled()) {
                log.debug("Retitled thread {} to '{}'", draft.threadId(), LogSanitizer.sanitize(draft.retitleTo()));
            }
        }
        return new AppendResult(message, retitled);
    }

    @Override
    public List<ConversationMessage> findMessages(String threadId, Integer limit) {
        Query query = new Query(Criteria.where("threadId").is(threadId))
                .with(Sort.by(Sort.Direction.ASC, "sequence"))
                .maxTime(this.maxTime);
        if (limit != null) {
            query.limit(limit);
        }
        try {
            return this.mongoTemplate.find(query, ConversationMessage.class);
        } catch (DataAccessException e) {
            throw StoreErrors.translate("History lookup", e);
        }
    }
}
