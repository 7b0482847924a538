package com.stockscore.ai;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaChatServiceTest {

    @Test
    void buildRequest_shouldCarryRolesAndTemperature() {
        JSONObject req = OllamaChatService.buildRequest(
                "deepseek-r1:8b",
                List.of(PromptMessage.system("rules"), PromptMessage.user("score it")),
                0.3,
                0
        );

        assertEquals("deepseek-r1:8b", req.getString("model"));
        assertFalse(req.getBoolean("stream"));
        JSONArray messages = req.getJSONArray("messages");
        assertEquals("system", messages.getJSONObject(0).getString("role"));
        assertEquals("user", messages.getJSONObject(1).getString("role"));
        assertEquals("score it", messages.getJSONObject(1).getString("content"));
        assertEquals(0.3, req.getJSONObject("options").getDouble("temperature"), 1e-9);
        assertFalse(req.getJSONObject("options").has("num_predict"));
    }

    @Test
    void buildRequest_shouldLimitTokensWhenConfigured() {
        JSONObject req = OllamaChatService.buildRequest("m", List.of(PromptMessage.user("x")), 0.7, 512);

        assertEquals(512, req.getJSONObject("options").getInt("num_predict"));
    }

    @Test
    void readContent_shouldExtractAssistantMessage() throws Exception {
        String raw = "{\"model\":\"m\",\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"a\\\":1}\"},\"done\":true}";

        assertEquals("{\"a\":1}", OllamaChatService.readContent(raw));
    }

    @Test
    void readContent_shouldFallBackToGenerateField() throws Exception {
        assertEquals("hello", OllamaChatService.readContent("{\"response\":\"hello\"}"));
        assertEquals("", OllamaChatService.readContent("  "));
    }

    @Test
    void readContent_shouldFailOnErrorPayloadOrBadJson() {
        IOException e = assertThrows(IOException.class, () -> OllamaChatService.readContent("{\"error\":\"model not found\"}"));
        assertTrue(e.getMessage().contains("model not found"));

        assertThrows(IOException.class, () -> OllamaChatService.readContent("<html>bad gateway</html>"));
    }

    @Test
    void describe_shouldNameTransportAndModel() {
        assertEquals("ollama-http:qwen", new OllamaChatService(null, "http://x/", "qwen", 0).describe());
    }
}
