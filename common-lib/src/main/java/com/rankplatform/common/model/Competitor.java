package com.rankplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rankplatform.common.exception.InvalidCompetitorException;

/**
 * A single ranked competitor.
 *
 * <ul>
 *   <li>{@code rating} – strength score in [{@value #MIN_RATING}, {@value #MAX_RATING}]; higher wins.</li>
 *   <li>{@code age}    – age in [{@value #MIN_AGE}, {@value #MAX_AGE}]; lower wins on equal rating.</li>
 *   <li>{@code name}   – display identifier, not required to be unique.</li>
 * </ul>
 *
 * <p>Equality is structural over all three fields. Out-of-range values are rejected
 * here, at construction time; the aggregator never re-validates.
 */
public record Competitor(
    @JsonProperty("rating") int rating,
    @JsonProperty("age")    int age,
    @JsonProperty("name")   String name
) {
    public static final int MIN_RATING = 0;
    public static final int MAX_RATING = 65_535;
    public static final int MIN_AGE    = 0;
    public static final int MAX_AGE    = 255;

    private static final Competitor PLACEHOLDER = new Competitor(0, 0, "");

    public Competitor {
        if (name == null) {
            throw new InvalidCompetitorException("<unnamed>", "name must not be null");
        }
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new InvalidCompetitorException(name,
                "rating " + rating + " outside [" + MIN_RATING + ", " + MAX_RATING + "]");
        }
        if (age < MIN_AGE || age > MAX_AGE) {
            throw new InvalidCompetitorException(name,
                "age " + age + " outside [" + MIN_AGE + ", " + MAX_AGE + "]");
        }
    }

    public static Competitor of(int rating, int age, String name) {
        return new Competitor(rating, age, name);
    }

    /** Zero-valued stand-in used as the champion of an empty result. */
    public static Competitor placeholder() {
        return PLACEHOLDER;
    }
}
