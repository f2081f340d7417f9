package com.syntaxprime.elephant.config;

import com.mongodb.TransactionOptions;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Multi-document transactions for message appends. Requires a replica set or sharded cluster.
 */
@Configuration
public class MongoTransactionConfig {

    @Bean
    public MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory,
                                                         ElephantProperties properties) {
        return new MongoTransactionManager(databaseFactory, commitOptions(properties));
    }

    /**
     * Commits are bounded server-side by the same limit as queries.
     */
    static TransactionOptions commitOptions(ElephantProperties properties) {
        return TransactionOptions.builder()
                .maxCommitTime(properties.getStore().getMaxTime().toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Bean
    public TransactionTemplate conversationTransactions(MongoTransactionManager transactionManager,
                                                        ElephantProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setTimeout((int) Math.max(1L, properties.getStore().getMaxTime().toSeconds()));
        return template;
    }
}
