package com.stockscore.output;

/**
 * A whole-run precondition failed (for example the progress directory cannot be
 * created). No per-entity fallback applies.
 */
public final class BatchFatalException extends RuntimeException {
    public BatchFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
