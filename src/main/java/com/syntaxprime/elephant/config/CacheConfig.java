package com.syntaxprime.elephant.config;

import com.syntaxprime.elephant.cache.ResultCache;
import com.syntaxprime.elephant.knowledge.KnowledgeQueryService;
import com.syntaxprime.elephant.knowledge.RankedEntry;
import com.syntaxprime.elephant.memory.CharRatioTokenEstimator;
import com.syntaxprime.elephant.memory.HistoryKey;
import com.syntaxprime.elephant.memory.TokenEstimator;
import com.syntaxprime.elephant.model.ConversationMessage;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    /**
     * History views live until an append to their thread invalidates them.
     */
    @Bean
    public ResultCache<HistoryKey, List<ConversationMessage>> historyCache(ElephantProperties properties) {
        return new ResultCache<>("history", properties.getMemory().getHistoryCacheMaxEntries(), null);
    }

    @Bean
    public ResultCache<KnowledgeQueryService.SearchKey, List<RankedEntry>> knowledgeSearchCache(ElephantProperties properties) {
        ElephantProperties.Knowledge knowledge = properties.getKnowledge();
        return new ResultCache<>("knowledge-search", knowledge.getCacheMaxEntries(), knowledge.getCacheTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenEstimator tokenEstimator(ElephantProperties properties) {
        return new CharRatioTokenEstimator(properties.getMemory().getCharsPerToken());
    }
}
