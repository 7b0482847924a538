package com.stockscore.ai;

import java.time.Duration;

public final class InvocationTimeoutException extends Exception {
    private final Duration elapsed;

    public InvocationTimeoutException(String label, Duration budget, Duration elapsed) {
        super("timed out after " + elapsed.toMillis() + "ms (budget " + budget.toSeconds() + "s) waiting for " + label);
        this.elapsed = elapsed;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
