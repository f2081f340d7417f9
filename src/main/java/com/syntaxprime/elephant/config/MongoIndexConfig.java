package com.syntaxprime.elephant.config;

import com.syntaxprime.elephant.model.ConversationMessage;
import com.syntaxprime.elephant.model.ConversationThread;
import com.syntaxprime.elephant.model.KnowledgeEntry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.TextIndexDefinition;

/**
 * Creates the indexes the stores depend on. Index creation is idempotent; an unreachable
 * database is reported and left to fail on first use.
 */
@Configuration
public class MongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(MongoIndexConfig.class);

    private final MongoTemplate mongoTemplate;
    private final ElephantProperties properties;

    public MongoIndexConfig(MongoTemplate mongoTemplate, ElephantProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.properties = properties;
    }

    @PostConstruct
    public void ensureIndexes() {
        if (!this.properties.getStore().isEnsureIndexes()) {
            log.info("Index creation disabled via configuration");
            return;
        }
        try {
            IndexOperations knowledge = this.mongoTemplate.indexOps(KnowledgeEntry.class);
            knowledge.ensureIndex(new TextIndexDefinition.TextIndexDefinitionBuilder()
                    .named("knowledge_text")
                    .onField("title", 2.0f)
                    .onField("content")
                    .build());
            knowledge.ensureIndex(new Index().on("projectId", Sort.Direction.ASC));
            knowledge.ensureIndex(new Index().on("keyTopics", Sort.Direction.ASC));

            this.mongoTemplate.indexOps(ConversationMessage.class).ensureIndex(new Index()
                    .on("threadId", Sort.Direction.ASC)
                    .on("sequence", Sort.Direction.ASC)
                    .unique());
            this.mongoTemplate.indexOps(ConversationThread.class).ensureIndex(new Index()
                    .on("ownerId", Sort.Direction.ASC)
                    .on("status", Sort.Direction.ASC)
                    .on("lastMessageAt", Sort.Direction.DESC));
            log.info("MongoDB indexes verified");
        } catch (DataAccessException e) {
            log.error("Failed to ensure MongoDB indexes: {}", e.getMessage());
        }
    }
}
