package com.syntaxprime.elephant.knowledge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.exception.TransientStoreException;
import com.syntaxprime.elephant.model.KnowledgeEntry;
import com.syntaxprime.elephant.model.KnowledgeProject;
import com.syntaxprime.elephant.model.KnowledgeSource;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

class MongoKnowledgeStoreTest {

    private MongoTemplate mongoTemplate;
    private MongoKnowledgeStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        store = new MongoKnowledgeStore(mongoTemplate, new ElephantProperties());
    }

    @Nested
    @DisplayName("fullTextSearch()")
    class FullTextSearchTest {
        @Test
        @DisplayName("Should join source and project lookups and carry the text score as native rank")
        void shouldJoinLookups() {
            KnowledgeEntry entry = new KnowledgeEntry("e-1", "Launch", "launch notes", "conversation", 300);
            entry.setSourceId("s-1");
            entry.setProjectId("p-1");
            entry.setTextScore(1.5f);
            when(mongoTemplate.find(any(Query.class), eq(KnowledgeEntry.class))).thenReturn(List.of(entry));
            when(mongoTemplate.find(any(Query.class), eq(KnowledgeSource.class)))
                    .thenReturn(List.of(new KnowledgeSource("s-1", "Chat export", "conversation")));
            when(mongoTemplate.find(any(Query.class), eq(KnowledgeProject.class)))
                    .thenReturn(List.of(new KnowledgeProject("p-1", "AMCF", "client_work")));

            List<KnowledgeCandidate> candidates = store.fullTextSearch(AugmentedQuery.of("launch", List.of("budget")), 10);

            assertThat(candidates).hasSize(1);
            KnowledgeCandidate candidate = candidates.get(0);
            assertThat(candidate.sourceType()).isEqualTo("conversation");
            assertThat(candidate.projectName()).isEqualTo("AMCF");
            assertThat(candidate.projectCategory()).isEqualTo("client_work");
            assertThat(candidate.nativeRank()).isEqualTo(1.5);
        }

        @Test
        @DisplayName("Should limit the query and skip lookups for an empty result")
        void shouldLimitQuery() {
            when(mongoTemplate.find(any(Query.class), eq(KnowledgeEntry.class))).thenReturn(List.of());

            assertThat(store.fullTextSearch(AugmentedQuery.of("launch", List.of()), 7)).isEmpty();

            ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).find(query.capture(), eq(KnowledgeEntry.class));
            assertThat(query.getValue().getLimit()).isEqualTo(7);
            verify(mongoTemplate, never()).find(any(Query.class), eq(KnowledgeSource.class));
        }

        @Test
        @DisplayName("Should search processed entries only, with quotes and negations read as plain terms")
        void shouldSearchPlainTermsOverProcessedEntries() {
            when(mongoTemplate.find(any(Query.class), eq(KnowledgeEntry.class))).thenReturn(List.of());

            store.fullTextSearch(AugmentedQuery.of("-launch \"budget review\"", List.of()), 10);

            ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).find(query.capture(), eq(KnowledgeEntry.class));
            Document filter = query.getValue().getQueryObject();
            assertThat(filter.get("processed")).isEqualTo(true);
            assertThat(filter.get("$text", Document.class).getString("$search")).isEqualTo("launch budget review");
        }

        @Test
        @DisplayName("A query made only of operators matches nothing without touching the store")
        void shouldSkipOperatorOnlyQuery() {
            assertThat(store.fullTextSearch(AugmentedQuery.of("- \"\" --", List.of()), 10)).isEmpty();

            verifyNoInteractions(mongoTemplate);
        }

        @Test
        @DisplayName("Should translate timeouts to TransientStoreException")
        void shouldTranslateTimeout() {
            when(mongoTemplate.find(any(Query.class), eq(KnowledgeEntry.class)))
                    .thenThrow(new QueryTimeoutException("operation exceeded time limit"));

            assertThatThrownBy(() -> store.fullTextSearch(AugmentedQuery.of("launch", List.of()), 10))
                    .isInstanceOf(TransientStoreException.class);
        }
    }

    @Test
    @DisplayName("Pattern rank favours title hits, then early body hits")
    void shouldRankPatternMatches() {
        KnowledgeEntry titled = new KnowledgeEntry("a", "Q3 Launch plan", "body", "document", 10);
        KnowledgeEntry early = new KnowledgeEntry("b", "Notes", "the launch is near", "document", 10);
        KnowledgeEntry late = new KnowledgeEntry("c", "Notes", "x".repeat(3000) + " launch", "document", 10);
        KnowledgeEntry none = new KnowledgeEntry("d", "Notes", "nothing here", "document", 10);

        assertThat(MongoKnowledgeStore.patternRank(titled, "launch")).isEqualTo(1.0);
        assertThat(MongoKnowledgeStore.patternRank(early, "LAUNCH")).isEqualTo(0.8);
        assertThat(MongoKnowledgeStore.patternRank(late, "launch")).isEqualTo(0.4);
        assertThat(MongoKnowledgeStore.patternRank(none, "launch")).isEqualTo(0.3);
    }

    @Test
    @DisplayName("plainTerms() drops phrase quotes and leading hyphens")
    void shouldStripTextOperators() {
        assertThat(MongoKnowledgeStore.plainTerms("  -launch   \"budget review\" co-op ")).isEqualTo("launch budget review co-op");
        assertThat(MongoKnowledgeStore.plainTerms(null)).isEmpty();
    }

    @Test
    @DisplayName("Pattern and related lookups are restricted to processed entries")
    void shouldRestrictLookupsToProcessed() {
        when(mongoTemplate.find(any(Query.class), eq(KnowledgeEntry.class))).thenReturn(List.of());
        KnowledgeEntry anchor = new KnowledgeEntry("a", "Anchor", "body", "document", 10);
        anchor.setProjectId("p-1");

        store.patternSearch("launch", 10);
        store.findRelated(anchor, 10);

        ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate, times(2)).find(queries.capture(), eq(KnowledgeEntry.class));
        assertThat(queries.getAllValues())
                .allSatisfy(q -> assertThat(q.getQueryObject().toString()).contains("processed=true"));
    }

    @Test
    @DisplayName("recordAccess() increments all ids in one update")
    void shouldRecordAccess() {
        store.recordAccess(List.of("e-1", "e-2"));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).updateMulti(query.capture(), any(UpdateDefinition.class), eq(KnowledgeEntry.class));
        assertThat(query.getValue().getMeta().getMaxTimeMsec()).isEqualTo(5000L);
    }

    @Test
    @DisplayName("recordAccess() with no ids does nothing")
    void shouldSkipEmptyAccess() {
        store.recordAccess(List.of());

        verifyNoInteractions(mongoTemplate);
    }

    @Test
    @DisplayName("findRelated() returns nothing for an anchor without project or topics")
    void shouldSkipRelatedWithoutSharedFields() {
        KnowledgeEntry anchor = new KnowledgeEntry("a", "Loose", "body", "document", 10);

        assertThat(store.findRelated(anchor, 10)).isEmpty();
        verifyNoInteractions(mongoTemplate);
    }
}
