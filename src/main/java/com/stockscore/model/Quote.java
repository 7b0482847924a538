package com.stockscore.model;

/**
 * Market snapshot for one entity. Every field is optional because providers
 * routinely omit values for halted or illiquid instruments.
 */
public final class Quote {
    public final String name;
    public final Double lastDone;
    public final Double open;
    public final Double high;
    public final Double low;
    public final Double prevClose;
    public final Double changePct; // %
    public final Long volume;
    public final Double turnover;

    public Quote(
            String name,
            Double lastDone,
            Double open,
            Double high,
            Double low,
            Double prevClose,
            Double changePct,
            Long volume,
            Double turnover
    ) {
        this.name = name == null ? "" : name.trim();
        this.lastDone = finiteOrNull(lastDone);
        this.open = finiteOrNull(open);
        this.high = finiteOrNull(high);
        this.low = finiteOrNull(low);
        this.prevClose = finiteOrNull(prevClose);
        this.changePct = resolveChangePct(finiteOrNull(changePct), this.lastDone, this.prevClose);
        this.volume = volume == null || volume < 0L ? null : volume;
        this.turnover = finiteOrNull(turnover);
    }

    public static Quote of(Double lastDone, Double changePct) {
        return new Quote("", lastDone, null, null, null, null, changePct, null, null);
    }

    public boolean hasPrice() {
        return lastDone != null;
    }

    private static Double finiteOrNull(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return null;
        }
        return value;
    }

    private static Double resolveChangePct(Double changePct, Double last, Double prevClose) {
        if (changePct != null) {
            return changePct;
        }
        if (last == null || prevClose == null || prevClose == 0.0) {
            return null;
        }
        return (last - prevClose) / prevClose * 100.0;
    }
}
