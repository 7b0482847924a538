package com.stockscore.ai;

import com.stockscore.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Minimal Ollama {@code /api/chat} client. Temperature and timeout travel with each
 * request, so one instance serves a whole run without rebuilding anything.
 */
public class OllamaChatService implements ModelService {
    private final HttpClientEx http;
    private final String baseUrl;
    private final String model;
    private final int maxTokens;

    public OllamaChatService(HttpClientEx http, String baseUrl, String model, int maxTokens) {
        this.http = http;
        this.baseUrl = trimSlash(baseUrl);
        this.model = model;
        this.maxTokens = Math.max(0, maxTokens);
    }

    @Override
    public String generate(List<PromptMessage> messages, double temperature, Duration timeout) throws IOException, InterruptedException {
        Duration effective = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Duration.ofMinutes(10)
                : timeout;
        String resp = http.postJson(baseUrl + "/api/chat", buildRequest(model, messages, temperature, maxTokens).toString(), effective);
        return readContent(resp);
    }

    @Override
    public String describe() {
        return "ollama-http:" + model;
    }

    static JSONObject buildRequest(String model, List<PromptMessage> messages, double temperature, int maxTokens) {
        JSONObject req = new JSONObject();
        req.put("model", model);
        req.put("stream", false);
        JSONArray arr = new JSONArray();
        if (messages != null) {
            for (PromptMessage m : messages) {
                if (m == null) {
                    continue;
                }
                JSONObject item = new JSONObject();
                item.put("role", m.role().name().toLowerCase(Locale.ROOT));
                item.put("content", m.content());
                arr.put(item);
            }
        }
        req.put("messages", arr);
        JSONObject options = new JSONObject();
        options.put("temperature", temperature);
        if (maxTokens > 0) {
            options.put("num_predict", maxTokens);
        }
        req.put("options", options);
        return req;
    }

    static String readContent(String raw) throws IOException {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        try {
            JSONObject root = new JSONObject(raw);
            String error = root.optString("error", "");
            if (!error.isEmpty()) {
                throw new IOException("ollama error: " + error);
            }
            JSONObject message = root.optJSONObject("message");
            if (message == null) {
                return root.optString("response", "");
            }
            return message.optString("content", "");
        } catch (JSONException e) {
            throw new IOException("unreadable ollama response: " + e.getMessage(), e);
        }
    }

    private static String trimSlash(String url) {
        String u = url == null ? "" : url.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
