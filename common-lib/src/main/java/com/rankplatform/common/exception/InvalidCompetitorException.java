package com.rankplatform.common.exception;

/**
 * Raised when a {@link com.rankplatform.common.model.Competitor} is built with an
 * out-of-range rating or age, or without a name.
 *
 * <p>The message is prefixed with the competitor name, e.g.
 * {@code [Kareem] rating 70000 outside [0, 65535]}. When Jackson binds an invalid
 * competitor, this exception is the cause of the mapping failure.
 */
public class InvalidCompetitorException extends RuntimeException {
    private final String competitorName;

    public InvalidCompetitorException(String competitorName, String message) {
        super("[" + competitorName + "] " + message);
        this.competitorName = competitorName;
    }

    public String getCompetitorName() {
        return competitorName;
    }
}
