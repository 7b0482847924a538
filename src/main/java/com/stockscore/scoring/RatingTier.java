package com.stockscore.scoring;

/**
 * Overall-score tiers, highest first. Lower bounds are inclusive.
 */
public enum RatingTier {
    STRONG_BUY(9.0, "StrongBuy", "green"),
    BUY(7.5, "Buy", "yellow"),
    HOLD(6.0, "Hold", "orange"),
    REDUCE(4.0, "Reduce", "red"),
    SELL(Double.NEGATIVE_INFINITY, "Sell", "black");

    public final double lowerBound;
    public final String label;
    public final String signal;

    RatingTier(double lowerBound, String label, String signal) {
        this.lowerBound = lowerBound;
        this.label = label;
        this.signal = signal;
    }

    public static RatingTier of(double overallScore) {
        for (RatingTier tier : values()) {
            if (overallScore >= tier.lowerBound) {
                return tier;
            }
        }
        return SELL;
    }
}
