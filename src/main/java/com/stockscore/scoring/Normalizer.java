package com.stockscore.scoring;

import com.stockscore.model.Quote;
import com.stockscore.model.ScoreResult;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a parsed model object into a {@link ScoreResult}: clamps and rounds the five
 * dimension scores, computes the weighted overall score and derives the rating tier.
 */
public final class Normalizer {
    public static final double NEUTRAL_SCORE = 5.0;

    public static final double WEIGHT_FUNDAMENTAL = 0.40;
    public static final double WEIGHT_TECHNICAL = 0.30;
    public static final double WEIGHT_GROWTH = 0.15;
    public static final double WEIGHT_SENTIMENT = 0.10;
    public static final double WEIGHT_INDUSTRY_RISK = 0.05;

    public ScoreResult normalize(JSONObject parsed, String fallbackId, String fallbackName, Quote quote) {
        JSONObject o = parsed == null ? new JSONObject() : parsed;

        double technical = dimension(o, "technical_score", "technical");
        double fundamental = dimension(o, "fundamental_score", "fundamental");
        double growth = dimension(o, "growth_score", "growth");
        double sentiment = dimension(o, "sentiment_score", "sentiment");
        double industryRisk = dimension(o, "industry_risk_score", "industry_risk");
        double overall = overallScore(fundamental, technical, growth, sentiment, industryRisk);

        RatingTier tier = RatingTier.of(overall);
        String rating = firstNonBlank(o.optString("rating", ""), tier.label);
        String signal = firstNonBlank(o.optString("signal", ""), tier.signal);

        Double price = number(o, "price");
        if (price == null && quote != null) {
            price = quote.lastDone;
        }
        Double changePct = number(o, "change_pct");
        if (changePct == null && quote != null) {
            changePct = quote.changePct;
        }

        String quoteName = quote == null ? "" : quote.name;
        String name = firstNonBlank(o.optString("name", ""), firstNonBlank(fallbackName, firstNonBlank(quoteName, fallbackId)));

        return ScoreResult.ok(
                fallbackId,
                name,
                price,
                changePct,
                technical,
                fundamental,
                growth,
                sentiment,
                industryRisk,
                overall,
                rating,
                signal,
                o.optString("reason", "").trim(),
                textList(o.opt("risks")),
                textList(o.opt("opportunities")),
                o.optString("suggestion", "").trim()
        );
    }

    public static double overallScore(double fundamental, double technical, double growth, double sentiment, double industryRisk) {
        double raw = fundamental * WEIGHT_FUNDAMENTAL
                + technical * WEIGHT_TECHNICAL
                + growth * WEIGHT_GROWTH
                + sentiment * WEIGHT_SENTIMENT
                + industryRisk * WEIGHT_INDUSTRY_RISK;
        return round(raw, 2);
    }

    static double clampScore(double value) {
        if (!Double.isFinite(value)) {
            return NEUTRAL_SCORE;
        }
        return round(Math.max(0.0, Math.min(10.0, value)), 1);
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static double dimension(JSONObject o, String key, String alias) {
        Double value = number(o, key);
        if (value == null) {
            value = number(o, alias);
        }
        return clampScore(value == null ? NEUTRAL_SCORE : value);
    }

    private static Double number(JSONObject o, String key) {
        Object raw = o.opt(key);
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            if (s.endsWith("%")) {
                s = s.substring(0, s.length() - 1).trim();
            }
            try {
                double d = Double.parseDouble(s);
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private static List<String> textList(Object raw) {
        List<String> out = new ArrayList<>();
        if (!(raw instanceof JSONArray)) {
            return out;
        }
        JSONArray arr = (JSONArray) raw;
        for (int i = 0; i < arr.length(); i++) {
            Object item = arr.opt(i);
            if (item == null || JSONObject.NULL.equals(item)) {
                continue;
            }
            String text = String.valueOf(item).trim();
            if (!text.isEmpty()) {
                out.add(text);
            }
        }
        return out;
    }

    private static String firstNonBlank(String value, String fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback == null ? "" : fallback.trim();
        }
        return value.trim();
    }
}
