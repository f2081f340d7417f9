package com.syntaxprime.elephant.memory;

/**
 * Approximate token cost of a piece of text. Swappable for a model-specific tokenizer.
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimate(String text);
}
