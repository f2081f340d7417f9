package com.syntaxprime.elephant.knowledge.personality;

import com.syntaxprime.elephant.knowledge.KnowledgeCandidate;
import java.util.List;

/**
 * Evaluates a personality's rule table in order; the first matching rule wins.
 */
public final class RuleTablePersonalityScorer implements PersonalityScorer {
    static final double NEUTRAL = 1.0;

    private final String id;
    private final List<PersonalityRule> rules;

    public RuleTablePersonalityScorer(String id, List<PersonalityRule> rules) {
        this.id = id;
        this.rules = List.copyOf(rules);
    }

    @Override
    public String id() {
        return this.id;
    }

    @Override
    public double factor(KnowledgeCandidate candidate) {
        for (PersonalityRule rule : this.rules) {
            if (rule.matches(candidate)) {
                return rule.getFactor();
            }
        }
        return NEUTRAL;
    }

    public List<PersonalityRule> rules() {
        return this.rules;
    }
}
