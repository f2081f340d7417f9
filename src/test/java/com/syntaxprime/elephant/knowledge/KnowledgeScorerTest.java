package com.syntaxprime.elephant.knowledge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.knowledge.personality.PersonalityRegistry;
import com.syntaxprime.elephant.knowledge.personality.PersonalityScorer;
import com.syntaxprime.elephant.model.KnowledgeEntry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KnowledgeScorerTest {

    private KnowledgeScorer scorer;
    private PersonalityScorer syntaxprime;

    @BeforeEach
    void setUp() {
        ElephantProperties properties = new ElephantProperties();
        scorer = new KnowledgeScorer(properties);
        syntaxprime = new PersonalityRegistry(properties).require("syntaxprime");
    }

    @Test
    @DisplayName("Should combine every signal into the final score")
    void shouldCombineSignals() {
        KnowledgeEntry entry = new KnowledgeEntry("e-1", "Launch plan", "The launch budget for Q3", "conversation", 500);
        entry.setAccessCount(4);
        entry.setRelevanceScore(8.0);
        KnowledgeCandidate candidate = new KnowledgeCandidate(entry, "processed", "AMCF", "client_work", 2.0);

        RankedEntry ranked = scorer.score(candidate, "launch", List.of("launch", "budget"), syntaxprime);

        ScoreBreakdown s = ranked.scoring();
        assertThat(s.nativeRank()).isEqualTo(2.0);
        assertThat(s.sourceWeight()).isEqualTo(0.9);
        assertThat(s.wordFactor()).isEqualTo(1.0);
        assertThat(s.personalityFactor()).isEqualTo(1.2);
        assertThat(s.projectBoost()).isEqualTo(0.2);
        // launch: body + title, budget: body
        assertThat(s.contextBonus()).isCloseTo(0.4, within(1e-9));
        assertThat(s.accessBonus()).isCloseTo(0.04, within(1e-9));
        assertThat(s.storedPrior()).isCloseTo(0.8, within(1e-9));
        double expected = 2.0 * 0.9 * 1.0 * 1.2 + 0.2 + 0.4 + 0.04 + 0.2 * 0.8;
        assertThat(ranked.finalScore()).isCloseTo(expected, within(1e-9));
        assertThat(ranked.projectName()).isEqualTo("AMCF");
        assertThat(ranked.snippet()).contains("launch");
    }

    @Test
    @DisplayName("Conversation entries outrank equally matched raw data for syntaxprime")
    void shouldPreferConversations() {
        KnowledgeEntry conversation = new KnowledgeEntry("c", "Email", "marketing email draft", "conversation", 500);
        KnowledgeEntry raw = new KnowledgeEntry("r", "Email", "marketing email draft", "document", 500);

        double conversationScore = scorer.score(new KnowledgeCandidate(conversation, "conversation", null, null, 1.0),
                "marketing email", List.of(), syntaxprime).finalScore();
        double rawScore = scorer.score(new KnowledgeCandidate(raw, "raw_data", null, null, 1.0),
                "marketing email", List.of(), syntaxprime).finalScore();

        assertThat(conversationScore).isGreaterThan(rawScore);
    }

    @Test
    @DisplayName("Word count factor favours 100-5000 words")
    void shouldApplyWordFactor() {
        assertThat(KnowledgeScorer.wordFactor(99)).isEqualTo(0.7);
        assertThat(KnowledgeScorer.wordFactor(100)).isEqualTo(1.0);
        assertThat(KnowledgeScorer.wordFactor(5000)).isEqualTo(1.0);
        assertThat(KnowledgeScorer.wordFactor(5001)).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Access bonus is capped at 0.1")
    void shouldCapAccessBonus() {
        assertThat(KnowledgeScorer.accessBonus(0)).isZero();
        assertThat(KnowledgeScorer.accessBonus(5)).isCloseTo(0.05, within(1e-9));
        assertThat(KnowledgeScorer.accessBonus(1000)).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Unknown source types and projects fall back to defaults")
    void shouldFallBackToDefaults() {
        assertThat(scorer.sourceWeight(null)).isEqualTo(0.5);
        assertThat(scorer.sourceWeight("scraped")).isEqualTo(0.5);
        assertThat(scorer.projectBoost("Business")).isEqualTo(0.15);
        assertThat(scorer.projectBoost("Unknown")).isZero();
        assertThat(scorer.projectBoost(null)).isZero();
    }

    @Test
    @DisplayName("Snippets centre on the first query hit")
    void shouldBuildSnippets() {
        String content = "x".repeat(1000) + " marketing email " + "y".repeat(1000);

        String snippet = Snippets.around(content, "marketing email");

        assertThat(snippet).startsWith("...").endsWith("...").contains("marketing email");
        assertThat(Snippets.around("short body", "absent")).isEqualTo("short body");
        assertThat(Snippets.around(null, "q")).isEmpty();
    }
}
