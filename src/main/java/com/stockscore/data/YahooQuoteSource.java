package com.stockscore.data;

import com.stockscore.data.http.HttpClientEx;
import com.stockscore.model.Quote;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Quotes from the public Yahoo chart endpoint (last two daily bars).
 */
public class YahooQuoteSource implements QuoteSource {
    private static final String CHART_URL = "https://query1.finance.yahoo.com/v8/finance/chart/";

    private final HttpClientEx http;
    private final Duration timeout;

    public YahooQuoteSource(HttpClientEx http, Duration timeout) {
        this.http = http;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    }

    @Override
    public Map<String, Quote> fetch(List<String> entityIds) {
        Map<String, Quote> out = new LinkedHashMap<>();
        for (String id : entityIds) {
            try {
                String body = http.getText(CHART_URL + toYahooSymbol(id) + "?range=5d&interval=1d", timeout);
                Quote quote = parseChart(body);
                if (quote != null) {
                    out.put(id, quote);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: quote fetch failed ticker=" + id + ", err=" + e.getMessage());
            }
        }
        return out;
    }

    static String toYahooSymbol(String entityId) {
        String id = entityId == null ? "" : entityId.trim().toUpperCase(Locale.ROOT);
        if (id.endsWith(".US")) {
            return id.substring(0, id.length() - 3);
        }
        if (id.endsWith(".HK")) {
            String digits = id.substring(0, id.length() - 3).replaceFirst("^0+", "");
            while (digits.length() < 4) {
                digits = "0" + digits;
            }
            return digits + ".HK";
        }
        return id;
    }

    static Quote parseChart(String body) {
        JSONObject root;
        try {
            root = new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            return null;
        }
        JSONObject chart = root.optJSONObject("chart");
        JSONArray result = chart == null ? null : chart.optJSONArray("result");
        JSONObject r0 = result == null || result.length() == 0 ? null : result.optJSONObject(0);
        if (r0 == null) return null;

        JSONObject meta = r0.optJSONObject("meta");
        JSONObject indicators = r0.optJSONObject("indicators");
        JSONArray quoteArr = indicators == null ? null : indicators.optJSONArray("quote");
        JSONObject q0 = quoteArr == null || quoteArr.length() == 0 ? null : quoteArr.optJSONObject(0);
        JSONArray closes = q0 == null ? null : q0.optJSONArray("close");
        if (closes == null) return null;

        int last = -1;
        int prev = -1;
        for (int i = closes.length() - 1; i >= 0; i--) {
            if (closes.isNull(i) || !Double.isFinite(closes.optDouble(i, Double.NaN))) continue;
            if (last < 0) {
                last = i;
            } else {
                prev = i;
                break;
            }
        }
        if (last < 0) return null;

        Double lastDone = meta == null ? null : finite(meta.optDouble("regularMarketPrice", Double.NaN));
        if (lastDone == null) {
            lastDone = at(closes, last);
        }
        Double prevClose = prev >= 0 ? at(closes, prev) : null;
        if (prevClose == null && meta != null) {
            prevClose = finite(meta.optDouble("chartPreviousClose", Double.NaN));
        }
        Double volume = at(q0.optJSONArray("volume"), last);
        String name = meta == null ? "" : meta.optString("shortName", meta.optString("longName", ""));
        return new Quote(
                name,
                lastDone,
                at(q0.optJSONArray("open"), last),
                at(q0.optJSONArray("high"), last),
                at(q0.optJSONArray("low"), last),
                prevClose,
                null,
                volume == null ? null : volume.longValue(),
                volume == null || lastDone == null ? null : volume * lastDone
        );
    }

    private static Double at(JSONArray arr, int index) {
        if (arr == null || index < 0 || index >= arr.length() || arr.isNull(index)) {
            return null;
        }
        return finite(arr.optDouble(index, Double.NaN));
    }

    private static Double finite(double v) {
        return Double.isFinite(v) ? v : null;
    }
}
