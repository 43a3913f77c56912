package com.rankplatform.common.ranking;

import com.rankplatform.common.model.Competitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link RankingAggregator}: a left fold over the input with an immutable accumulator.
 *
 * <h3>Fold step</h3>
 * <ol>
 *   <li>No champion yet → the competitor becomes sole champion.</li>
 *   <li>Tied with the champion (equal rating and age) → champion kept, competitor
 *       appended to the tie list unless a structurally equal entry is already there.</li>
 *   <li>Outranks the champion (higher rating, or equal rating and younger) → it becomes
 *       sole champion and the tie list is cleared.</li>
 *   <li>Otherwise → discarded.</li>
 * </ol>
 *
 * <p>The champion is therefore the first competitor in input order carrying the best
 * (rating, age) pair, and the tie list holds every distinct competitor with that pair.
 * Both are independent of input order as sets.
 *
 * <p>This class is stateless and thread-safe.
 */
public class DefaultRankingAggregator implements RankingAggregator {

    @Override
    public RankingResult aggregate(List<Competitor> competitors) {
        RankingResult result = RankingResult.empty();
        if (competitors == null) return result;
        for (Competitor competitor : competitors) {
            result = accumulate(result, competitor);
        }
        return result;
    }

    @Override
    public RankingResult accumulate(RankingResult result, Competitor competitor) {
        Objects.requireNonNull(competitor, "competitor");
        int count = result.competitorCount() + 1;

        if (!result.hasChampion()) {
            return RankingResult.sole(competitor, count);
        }

        Competitor champion = result.champion();
        if (CompetitorRanking.areTied(champion, competitor)) {
            return new RankingResult(champion, appendDistinct(result.topTier(), List.of(competitor)), count);
        }
        if (CompetitorRanking.outranks(competitor, champion)) {
            return RankingResult.sole(competitor, count);
        }
        return new RankingResult(champion, result.possibleChampions(), count);
    }

    @Override
    public RankingResult merge(RankingResult left, RankingResult right) {
        if (!right.hasChampion()) return left;
        if (!left.hasChampion())  return right;

        int count = left.competitorCount() + right.competitorCount();
        Competitor leftChampion  = left.champion();
        Competitor rightChampion = right.champion();

        if (CompetitorRanking.areTied(leftChampion, rightChampion)) {
            return new RankingResult(leftChampion, appendDistinct(left.topTier(), right.topTier()), count);
        }
        RankingResult winner = CompetitorRanking.outranks(rightChampion, leftChampion) ? right : left;
        return new RankingResult(winner.champion(), winner.possibleChampions(), count);
    }

    private static List<Competitor> appendDistinct(List<Competitor> tier, List<Competitor> additions) {
        List<Competitor> merged = new ArrayList<>(tier);
        for (Competitor candidate : additions) {
            if (!merged.contains(candidate)) {
                merged.add(candidate);
            }
        }
        return merged;
    }
}
