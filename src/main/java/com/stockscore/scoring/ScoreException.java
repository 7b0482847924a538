package com.stockscore.scoring;

import com.stockscore.model.ErrorKind;

/**
 * Raised by {@link Scorer} once every attempt for an entity has failed. Carries the
 * kind of the last failure.
 */
public final class ScoreException extends Exception {
    private final ErrorKind kind;
    private final int attempts;

    public ScoreException(ErrorKind kind, String message, int attempts, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.UNEXPECTED : kind;
        this.attempts = Math.max(0, attempts);
    }

    public ErrorKind kind() {
        return kind;
    }

    public int attempts() {
        return attempts;
    }
}
