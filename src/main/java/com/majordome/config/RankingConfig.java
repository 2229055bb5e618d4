package com.majordome.config;

/**
 * Ranking window.
 *
 * @param defaultLimit Result window for whole-catalog rankings
 */
public record RankingConfig(
        int defaultLimit
) {
    public static RankingConfig defaults() {
        return new RankingConfig(10);
    }
}
