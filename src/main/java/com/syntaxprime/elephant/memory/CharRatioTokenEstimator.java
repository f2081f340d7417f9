package com.syntaxprime.elephant.memory;

/**
 * {@code length / charsPerToken}, rounded down. Independent of any model vocabulary and
 * deliberately coarse.
 */
public class CharRatioTokenEstimator implements TokenEstimator {
    private final int charsPerToken;

    public CharRatioTokenEstimator(int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive");
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int estimate(String text) {
        if (text == null) {
            return 0;
        }
        return text.length() / this.charsPerToken;
    }
}
