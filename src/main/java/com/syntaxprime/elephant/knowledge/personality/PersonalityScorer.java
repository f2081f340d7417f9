package com.syntaxprime.elephant.knowledge.personality;

import com.syntaxprime.elephant.knowledge.KnowledgeCandidate;

/**
 * Personality-specific multiplier applied to a candidate's text relevance. Implementations are pure.
 */
public interface PersonalityScorer {

    String id();

    double factor(KnowledgeCandidate candidate);
}
