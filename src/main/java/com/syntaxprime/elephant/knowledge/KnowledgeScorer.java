package com.syntaxprime.elephant.knowledge;

import com.syntaxprime.elephant.config.ElephantProperties;
import com.syntaxprime.elephant.knowledge.personality.PersonalityScorer;
import com.syntaxprime.elephant.model.KnowledgeEntry;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Multi-signal re-ranking of full-text candidates.
 *
 * <pre>
 * finalScore = nativeRank * sourceWeight * wordFactor * personalityFactor
 *            + projectBoost + contextBonus + accessBonus + 0.2 * storedPrior
 * </pre>
 */
@Component
public class KnowledgeScorer {
    static final double BODY_KEYWORD_BONUS = 0.1;
    static final double TITLE_KEYWORD_BONUS = 0.2;
    static final double MAX_ACCESS_BONUS = 0.1;
    static final double STORED_PRIOR_WEIGHT = 0.2;

    private final ElephantProperties.Knowledge config;

    public KnowledgeScorer(ElephantProperties properties) {
        this.config = properties.getKnowledge();
    }

    public RankedEntry score(KnowledgeCandidate candidate, String query, List<String> contextKeywords, PersonalityScorer personality) {
        KnowledgeEntry entry = candidate.entry();
        double nativeRank = candidate.nativeRank();
        double sourceWeight = this.sourceWeight(candidate.sourceType());
        double wordFactor = wordFactor(entry.getWordCount());
        double personalityFactor = personality.factor(candidate);
        double projectBoost = this.projectBoost(candidate.projectName());
        double contextBonus = contextBonus(entry, contextKeywords);
        double accessBonus = accessBonus(entry.getAccessCount());
        double storedPrior = entry.getRelevanceScore() / 10.0;

        double finalScore = nativeRank * sourceWeight * wordFactor * personalityFactor
                + projectBoost
                + contextBonus
                + accessBonus
                + STORED_PRIOR_WEIGHT * storedPrior;

        ScoreBreakdown breakdown = new ScoreBreakdown(nativeRank, sourceWeight, wordFactor, personalityFactor,
                projectBoost, contextBonus, accessBonus, storedPrior);
        return new RankedEntry(entry, candidate.sourceType(), candidate.projectName(), candidate.projectCategory(),
                Snippets.around(entry.getContent(), query), finalScore, breakdown);
    }

    double sourceWeight(String sourceType) {
        if (sourceType == null) {
            return this.config.getDefaultSourceWeight();
        }
        return this.config.getSourceWeights().getOrDefault(sourceType, this.config.getDefaultSourceWeight());
    }

    double projectBoost(String projectName) {
        if (projectName == null) {
            return 0.0;
        }
        Map<String, Double> boosts = this.config.getProjectBoosts();
        return boosts.getOrDefault(projectName, 0.0);
    }

    /**
     * 100-5000 words is the sweet spot; short entries are penalized harder than long ones.
     */
    static double wordFactor(int wordCount) {
        if (wordCount < 100) {
            return 0.7;
        }
        if (wordCount <= 5000) {
            return 1.0;
        }
        return 0.9;
    }

    static double contextBonus(KnowledgeEntry entry, List<String> contextKeywords) {
        if (contextKeywords == null || contextKeywords.isEmpty()) {
            return 0.0;
        }
        String content = entry.getContent() == null ? "" : entry.getContent().toLowerCase(Locale.ROOT);
        String title = entry.getTitle() == null ? "" : entry.getTitle().toLowerCase(Locale.ROOT);
        double bonus = 0.0;
        for (String keyword : contextKeywords) {
            if (content.contains(keyword)) {
                bonus += BODY_KEYWORD_BONUS;
            }
            if (title.contains(keyword)) {
                bonus += TITLE_KEYWORD_BONUS;
            }
        }
        return bonus;
    }

    static double accessBonus(long accessCount) {
        return Math.min(MAX_ACCESS_BONUS, accessCount / 100.0);
    }
}
