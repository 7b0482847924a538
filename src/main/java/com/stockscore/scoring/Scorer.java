package com.stockscore.scoring;

import com.stockscore.ai.HeartbeatInvoker;
import com.stockscore.ai.InvocationTimeoutException;
import com.stockscore.ai.ModelService;
import com.stockscore.ai.PromptMessage;
import com.stockscore.config.Config;
import com.stockscore.model.ErrorKind;
import com.stockscore.model.Quote;
import com.stockscore.model.ScoreResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Scores a single entity: builds the request, calls the model through a
 * {@link HeartbeatInvoker}, then parses and normalizes the reply. Failed attempts
 * are retried up to a fixed cap; nothing but the last error survives an attempt.
 */
public final class Scorer {
    private static final Logger LOG = LogManager.getLogger(Scorer.class);

    private final ModelService model;
    private final HeartbeatInvoker invoker;
    private final ResponseParser parser = new ResponseParser();
    private final Normalizer normalizer = new Normalizer();
    private final double temperature;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public Scorer(ModelService model, HeartbeatInvoker invoker, double temperature, int maxAttempts, long retryBackoffMs) {
        if (model == null) {
            throw new IllegalArgumentException("model must not be null");
        }
        this.model = model;
        this.invoker = invoker == null
                ? new HeartbeatInvoker(Duration.ofMillis(200), Duration.ofSeconds(5), Duration.ZERO)
                : invoker;
        this.temperature = temperature;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoffMs = Math.max(0L, retryBackoffMs);
    }

    public static Scorer fromConfig(Config config, ModelService model) {
        HeartbeatInvoker invoker = new HeartbeatInvoker(
                Duration.ofMillis(Math.max(10, config.getInt("ai.poll_ms", 200))),
                Duration.ofSeconds(Math.max(0, config.getInt("ai.heartbeat_sec", 5))),
                Duration.ofSeconds(Math.max(0, config.getInt("ai.timeout_sec", 180)))
        );
        return new Scorer(
                model,
                invoker,
                config.getDouble("ai.temperature", 0.7),
                config.getInt("ai.max_attempts", 3),
                config.getLong("ai.retry_backoff_ms", 0L)
        );
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public ScoreResult scoreOne(String entityId, Quote quote) throws ScoreException, InterruptedException {
        List<PromptMessage> messages = Prompts.buildMessages(entityId, quote);
        String fallbackName = quote == null ? "" : quote.name;
        ScoreException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String label = entityId + " attempt " + attempt + "/" + maxAttempts;
            LOG.info("scoring {} via {}", label, model.describe());
            try {
                String raw = invoker.invoke(label, () -> model.generate(messages, temperature, invoker.timeout()));
                if (raw == null || raw.isBlank()) {
                    last = new ScoreException(ErrorKind.PROVIDER, "empty response from model", attempt, null);
                } else {
                    JSONObject parsed = parser.parse(raw);
                    return normalizer.normalize(parsed, entityId, fallbackName, quote).withAttempts(attempt);
                }
            } catch (InvocationTimeoutException e) {
                last = new ScoreException(ErrorKind.TIMEOUT, e.getMessage(), attempt, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                last = new ScoreException(ErrorKind.PROVIDER, "model call failed: " + describe(cause), attempt, cause);
            } catch (ResponseParseException e) {
                last = new ScoreException(
                        ErrorKind.PARSE,
                        "unparseable response (" + e.reason() + "): " + e.getMessage(),
                        attempt,
                        e
                );
            }

            LOG.warn("attempt failed {} kind={} err={}", label, last.kind(), last.getMessage());
            if (attempt < maxAttempts && retryBackoffMs > 0L) {
                Thread.sleep(retryBackoffMs);
            }
        }
        throw last;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) {
            return t.getClass().getSimpleName();
        }
        return t.getClass().getSimpleName() + ": " + msg;
    }
}
