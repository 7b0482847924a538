package com.stockscore.data;

import com.stockscore.model.Quote;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads quotes from a JSON file keyed by entity id. Two layouts are accepted:
 * flat ({@code {"NVDA.US": {"last_done": 1.0, ...}}}) and the nested quote-API dump
 * ({@code {"data": {"NVDA.US": {"name": "...", "price": {...}, "volume": 1}}}}).
 */
public final class JsonFileQuoteSource implements QuoteSource {
    private final Path path;

    public JsonFileQuoteSource(Path path) {
        this.path = path;
    }

    @Override
    public Map<String, Quote> fetch(List<String> entityIds) {
        Map<String, Quote> out = new LinkedHashMap<>();
        if (path == null || !Files.exists(path)) {
            System.err.println("WARN: quote file not found: " + path);
            return out;
        }
        JSONObject root;
        try {
            root = new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException | JSONException e) {
            System.err.println("WARN: failed to read quote file " + path + ", err=" + e.getMessage());
            return out;
        }
        JSONObject data = root.optJSONObject("data");
        JSONObject byId = data == null ? root : data;
        for (String id : entityIds) {
            JSONObject item = byId.optJSONObject(id);
            if (item != null) {
                out.put(id, parseQuote(item));
            }
        }
        return out;
    }

    static Quote parseQuote(JSONObject item) {
        JSONObject price = item.optJSONObject("price");
        JSONObject p = price == null ? item : price;
        return new Quote(
                item.optString("name", ""),
                positive(p, "last_done"),
                positive(p, "open"),
                positive(p, "high"),
                positive(p, "low"),
                positive(p, "prev_close"),
                number(p, "change_pct"),
                item.has("volume") ? item.optLong("volume", 0L) : null,
                number(item, "turnover")
        );
    }

    // Quote dumps write 0 for fields the exchange did not report.
    private static Double positive(JSONObject o, String key) {
        Double v = number(o, key);
        return v == null || v <= 0.0 ? null : v;
    }

    private static Double number(JSONObject o, String key) {
        if (!o.has(key) || o.isNull(key)) {
            return null;
        }
        double v = o.optDouble(key, Double.NaN);
        return Double.isFinite(v) ? v : null;
    }
}
