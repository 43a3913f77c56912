package com.rankplatform.common.ranking;

import com.rankplatform.common.model.Competitor;

import java.util.List;
import java.util.Objects;

/**
 * Immutable output of a {@link RankingAggregator} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code champion}         : best competitor seen so far; the placeholder when nothing was ranked</li>
 *   <li>{@code possibleChampions}: distinct competitors tied with the champion, first-seen order,
 *                                   champion included; empty when the champion is unique</li>
 *   <li>{@code competitorCount}  : number of input competitors folded into this result</li>
 * </ul>
 *
 * <p>A tie list with fewer than two entries is collapsed to empty, so a competitor
 * listed twice does not contest its own title. A longer tie list must contain the
 * champion, and every entry must be tied with it; otherwise construction fails with
 * {@link IllegalArgumentException}.
 */
public record RankingResult(
    Competitor champion,
    List<Competitor> possibleChampions,
    int competitorCount
) {

    private static final RankingResult EMPTY =
        new RankingResult(Competitor.placeholder(), List.of(), 0);

    public RankingResult {
        Objects.requireNonNull(champion, "champion");
        possibleChampions = (possibleChampions == null || possibleChampions.size() < 2)
            ? List.of()
            : List.copyOf(possibleChampions);
        if (competitorCount < 0) {
            throw new IllegalArgumentException("competitorCount must be >= 0, was " + competitorCount);
        }
        if (!possibleChampions.isEmpty()) {
            if (!possibleChampions.contains(champion)) {
                throw new IllegalArgumentException("tie list " + possibleChampions
                    + " does not contain champion " + champion);
            }
            for (Competitor entry : possibleChampions) {
                if (!CompetitorRanking.areTied(champion, entry)) {
                    throw new IllegalArgumentException(entry + " is not tied with champion " + champion);
                }
            }
        }
    }

    /** Placeholder result: zero-valued champion, no ties, nothing counted. */
    public static RankingResult empty() {
        return EMPTY;
    }

    static RankingResult sole(Competitor champion, int competitorCount) {
        return new RankingResult(champion, List.of(), competitorCount);
    }

    /** False only for a result built from no competitors at all. */
    public boolean hasChampion() {
        return competitorCount > 0;
    }

    public boolean isContested() {
        return !possibleChampions.isEmpty();
    }

    /**
     * The whole best tier: {@code possibleChampions} when contested, otherwise
     * just the champion. Empty for the placeholder result.
     */
    public List<Competitor> topTier() {
        if (!hasChampion()) return List.of();
        return isContested() ? possibleChampions : List.of(champion);
    }
}
