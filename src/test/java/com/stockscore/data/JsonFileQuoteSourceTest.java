package com.stockscore.data;

import com.stockscore.model.Quote;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileQuoteSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void fetch_shouldReadNestedQuoteDump() throws Exception {
        Path file = tempDir.resolve("quotes.json");
        Files.writeString(file, "{\"data\": {"
                + "\"NVDA.US\": {\"name\": \"NVIDIA\", \"price\": {\"last_done\": 120.5, \"open\": 118, \"high\": 121,"
                + " \"low\": 117.5, \"prev_close\": 119, \"change_pct\": 1.26}, \"volume\": 1000, \"turnover\": 120500.0},"
                + "\"AAPL.US\": {\"price\": {\"last_done\": 0, \"prev_close\": 180}}"
                + "}}", StandardCharsets.UTF_8);

        Map<String, Quote> quotes = new JsonFileQuoteSource(file).fetch(List.of("NVDA.US", "AAPL.US", "TSLA.US"));

        Quote nvda = quotes.get("NVDA.US");
        assertEquals("NVIDIA", nvda.name);
        assertEquals(120.5, nvda.lastDone, 1e-9);
        assertEquals(119.0, nvda.prevClose, 1e-9);
        assertEquals(1.26, nvda.changePct, 1e-9);
        assertEquals(1000L, nvda.volume);
        assertNull(quotes.get("AAPL.US").lastDone);
        assertFalse(quotes.get("AAPL.US").hasPrice());
        assertFalse(quotes.containsKey("TSLA.US"));
    }

    @Test
    void fetch_shouldReadFlatLayout() throws Exception {
        Path file = tempDir.resolve("flat.json");
        Files.writeString(file, "{\"0700.HK\": {\"last_done\": 300, \"prev_close\": 250}}", StandardCharsets.UTF_8);

        Quote q = new JsonFileQuoteSource(file).fetch(List.of("0700.HK")).get("0700.HK");

        assertEquals(300.0, q.lastDone, 1e-9);
        assertEquals(20.0, q.changePct, 1e-9);
    }

    @Test
    void fetch_shouldReturnEmptyForMissingOrBrokenFile() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{not json", StandardCharsets.UTF_8);

        assertTrue(new JsonFileQuoteSource(tempDir.resolve("absent.json")).fetch(List.of("A")).isEmpty());
        assertTrue(new JsonFileQuoteSource(broken).fetch(List.of("A")).isEmpty());
    }

    @Test
    void parseQuote_shouldIgnoreNullFields() {
        Quote q = JsonFileQuoteSource.parseQuote(new JSONObject("{\"last_done\": null, \"change_pct\": -2.5}"));

        assertNull(q.lastDone);
        assertEquals(-2.5, q.changePct, 1e-9);
        assertNull(q.volume);
    }
}
