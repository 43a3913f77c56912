package com.rankplatform.common.ranking;

import com.rankplatform.common.model.Competitor;

import java.util.Comparator;

/**
 * Comparison vocabulary for the two-key champion ordering:
 * rating descending, then age ascending.
 *
 * <p>Names never take part in a comparison. Two competitors compare equal under
 * {@link #BEST_FIRST} iff {@link #areTied} holds.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class CompetitorRanking {

    /** Best competitor first: highest rating, then youngest. */
    public static final Comparator<Competitor> BEST_FIRST =
        Comparator.comparingInt(Competitor::rating).reversed()
                  .thenComparingInt(Competitor::age);

    private CompetitorRanking() {}

    public static boolean isStronger(Competitor target, Competitor other) {
        return target.rating() > other.rating();
    }

    public static boolean isYounger(Competitor target, Competitor other) {
        return target.age() < other.age();
    }

    public static boolean areTied(Competitor target, Competitor other) {
        return target.rating() == other.rating() && target.age() == other.age();
    }

    /**
     * True when {@code challenger} strictly beats {@code holder}: stronger rating,
     * or equal rating and younger.
     */
    public static boolean outranks(Competitor challenger, Competitor holder) {
        if (isStronger(challenger, holder)) return true;
        return challenger.rating() == holder.rating() && isYounger(challenger, holder);
    }
}
