package com.rankplatform.common.ranking;

import com.rankplatform.common.model.Competitor;

import java.util.List;

/**
 * Contract for folding a flat snapshot of competitors into its champion and the
 * competitors tied with it.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging or I/O</li>
 *   <li><b>Total</b>: never throw for valid competitors; never return {@code null}</li>
 * </ul>
 *
 * <p>Current implementation: {@link DefaultRankingAggregator}.
 */
public interface RankingAggregator {

    /**
     * Ranks the given competitors.
     *
     * @param competitors competitors in input order; {@code null} or empty yields {@link RankingResult#empty()}
     * @return the champion and its ties, never {@code null}
     */
    RankingResult aggregate(List<Competitor> competitors);

    /**
     * Single fold step: returns a new result with {@code competitor} applied to {@code result}.
     */
    RankingResult accumulate(RankingResult result, Competitor competitor);

    /**
     * Combines two partial results, {@code left} covering input that precedes {@code right}.
     * Associative, with {@link RankingResult#empty()} as identity.
     */
    RankingResult merge(RankingResult left, RankingResult right);
}
