package com.stockscore.scoring;

public final class ResponseParseException extends Exception {
    public enum Reason {
        NOT_FOUND,
        NOT_AN_OBJECT
    }

    private final Reason reason;

    public ResponseParseException(Reason reason, String message) {
        super(message);
        this.reason = reason == null ? Reason.NOT_FOUND : reason;
    }

    public Reason reason() {
        return reason;
    }
}
