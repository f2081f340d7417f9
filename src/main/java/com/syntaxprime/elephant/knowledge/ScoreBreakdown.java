package com.syntaxprime.elephant.knowledge;

public record ScoreBreakdown(
        double nativeRank,
        double sourceWeight,
        double wordFactor,
        double personalityFactor,
        double projectBoost,
        double contextBonus,
        double accessBonus,
        double storedPrior
) {
}
