package com.rankplatform.ranking.config;

/**
 * Tuning for {@link com.rankplatform.ranking.service.RankingService#rankInParallel}.
 *
 * <ul>
 *   <li>{@code parallelThreshold} – inputs smaller than this are ranked on the calling thread</li>
 *   <li>{@code chunkSize}         – competitors per chunk once the threshold is reached</li>
 * </ul>
 */
public record RankingProperties(int parallelThreshold, int chunkSize) {

    public RankingProperties {
        if (parallelThreshold < 1) {
            throw new IllegalStateException("ranking.parallel.threshold must be >= 1, was " + parallelThreshold);
        }
        if (chunkSize < 1) {
            throw new IllegalStateException("ranking.parallel.chunk-size must be >= 1, was " + chunkSize);
        }
    }
}
