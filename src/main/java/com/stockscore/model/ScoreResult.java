package com.stockscore.model;

import java.util.List;

public final class ScoreResult {
    public final String entityId;
    public final String displayName;
    public final Double price;
    public final Double changePct;
    public final double technical;
    public final double fundamental;
    public final double growth;
    public final double sentiment;
    public final double industryRisk;
    public final double overallScore;
    public final String rating;
    public final String signal;
    public final String reason;
    public final List<String> risks;
    public final List<String> opportunities;
    public final String suggestion;
    public final boolean ok;
    public final String error;
    public final ErrorKind errorKind;
    public final int attempts;

    private ScoreResult(
            String entityId,
            String displayName,
            Double price,
            Double changePct,
            double technical,
            double fundamental,
            double growth,
            double sentiment,
            double industryRisk,
            double overallScore,
            String rating,
            String signal,
            String reason,
            List<String> risks,
            List<String> opportunities,
            String suggestion,
            boolean ok,
            String error,
            ErrorKind errorKind,
            int attempts
    ) {
        this.entityId = entityId == null ? "" : entityId;
        this.displayName = displayName == null || displayName.isBlank() ? this.entityId : displayName;
        this.price = price;
        this.changePct = changePct;
        this.technical = technical;
        this.fundamental = fundamental;
        this.growth = growth;
        this.sentiment = sentiment;
        this.industryRisk = industryRisk;
        this.overallScore = overallScore;
        this.rating = rating == null ? "" : rating;
        this.signal = signal == null ? "" : signal;
        this.reason = reason == null ? "" : reason;
        this.risks = risks == null ? List.of() : List.copyOf(risks);
        this.opportunities = opportunities == null ? List.of() : List.copyOf(opportunities);
        this.suggestion = suggestion == null ? "" : suggestion;
        this.ok = ok;
        this.error = ok ? null : (error == null || error.isBlank() ? "unknown error" : error);
        this.errorKind = ok ? ErrorKind.NONE : (errorKind == null ? ErrorKind.UNEXPECTED : errorKind);
        this.attempts = Math.max(0, attempts);
    }

    public static ScoreResult ok(
            String entityId,
            String displayName,
            Double price,
            Double changePct,
            double technical,
            double fundamental,
            double growth,
            double sentiment,
            double industryRisk,
            double overallScore,
            String rating,
            String signal,
            String reason,
            List<String> risks,
            List<String> opportunities,
            String suggestion
    ) {
        return new ScoreResult(
                entityId,
                displayName,
                price,
                changePct,
                technical,
                fundamental,
                growth,
                sentiment,
                industryRisk,
                overallScore,
                rating,
                signal,
                reason,
                risks,
                opportunities,
                suggestion,
                true,
                null,
                ErrorKind.NONE,
                0
        );
    }

    public static ScoreResult failed(String entityId, Quote quote, ErrorKind kind, String error, int attempts) {
        Double price = quote == null ? null : quote.lastDone;
        Double changePct = quote == null ? null : quote.changePct;
        String name = quote == null ? "" : quote.name;
        return new ScoreResult(
                entityId,
                name,
                price,
                changePct,
                0.0,
                0.0,
                0.0,
                0.0,
                0.0,
                0.0,
                "",
                "",
                "",
                List.of(),
                List.of(),
                "",
                false,
                error,
                kind,
                attempts
        );
    }

    public static ScoreResult missingData(String entityId) {
        return failed(entityId, null, ErrorKind.MISSING_DATA, "missing data: no quote for " + entityId, 0);
    }

    public ScoreResult withAttempts(int attempts) {
        return new ScoreResult(
                entityId,
                displayName,
                price,
                changePct,
                technical,
                fundamental,
                growth,
                sentiment,
                industryRisk,
                overallScore,
                rating,
                signal,
                reason,
                risks,
                opportunities,
                suggestion,
                ok,
                error,
                errorKind,
                attempts
        );
    }
}
