package com.stockscore.ai;

import java.time.Duration;
import java.util.List;

/**
 * Text-generation backend. Implementations are shared across every call of a run
 * and must not change their own settings while a call is outstanding.
 */
public interface ModelService {

    String generate(List<PromptMessage> messages, double temperature, Duration timeout) throws Exception;

    default String describe() {
        return getClass().getSimpleName();
    }
}
