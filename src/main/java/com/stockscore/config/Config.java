package com.stockscore.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration: built-in defaults, then classpath
 * {@code config.properties}, then {@code ./config.properties} in the working directory.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a config from explicit overrides on top of the defaults. Nested maps are
     * flattened with dots, so {@code {"ai": {"model": "x"}}} becomes {@code ai.model=x}.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> overrides) {
        Config config = new Config(workingDir);
        flattenInto(config, "", overrides);
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        try {
            return Long.parseLong(getString(key).trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    /**
     * Where the effective value of {@code key} came from: override, resource or default.
     */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String nonBlank(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                flattenInto(config, prefix.isEmpty() ? key : prefix + "." + key, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(item == null ? "" : String.valueOf(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, String.valueOf(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        config.overrideProps.setProperty(key.trim(), value == null ? "" : value);
        config.props.setProperty(key.trim(), value == null ? "" : value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (RuntimeException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (RuntimeException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("stock.list", "NVDA.US,AAPL.US");
        defaults.put("quotes.source", "file");
        defaults.put("quotes.path", "quotes.json");
        defaults.put("quotes.timeout_sec", "30");

        defaults.put("ai.provider", "langchain4j");
        defaults.put("ai.base_url", "http://127.0.0.1:11434");
        defaults.put("ai.model", "deepseek-r1:8b");
        defaults.put("ai.temperature", "0.7");
        defaults.put("ai.max_tokens", "0");
        defaults.put("ai.timeout_sec", "180");
        defaults.put("ai.heartbeat_sec", "5");
        defaults.put("ai.poll_ms", "200");
        defaults.put("ai.max_attempts", "3");
        defaults.put("ai.retry_backoff_ms", "0");

        return Collections.unmodifiableMap(defaults);
    }
}
