package com.stockscore.ai;

import com.stockscore.config.Config;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.output.Response;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Model service backed by a LangChain4j chat model (Ollama by default).
 * <p>
 * LangChain4j fixes temperature and timeout when the model is built, so one model
 * is built per distinct setting pair and reused afterwards. A run only ever asks
 * for one pair.
 */
public final class LangChainModelService implements ModelService {
    private final String modelName;
    private final Function<Settings, ChatLanguageModel> factory;
    private final Map<Settings, ChatLanguageModel> models = new ConcurrentHashMap<>();

    record Settings(double temperature, Duration timeout) {
    }

    public LangChainModelService(Config config) {
        String baseUrl = config.getString("ai.base_url", "http://127.0.0.1:11434");
        this.modelName = config.getString("ai.model", "deepseek-r1:8b");
        this.factory = settings -> OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .temperature(settings.temperature())
                .timeout(settings.timeout())
                .build();
    }

    LangChainModelService(ChatLanguageModel chatModel) {
        if (chatModel == null) {
            throw new IllegalArgumentException("chatModel must not be null");
        }
        this.modelName = chatModel.getClass().getSimpleName();
        this.factory = ignored -> chatModel;
    }

    @Override
    public String generate(List<PromptMessage> messages, double temperature, Duration timeout) {
        Duration effective = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Duration.ofMinutes(10)
                : timeout;
        ChatLanguageModel model = models.computeIfAbsent(new Settings(temperature, effective), factory);
        Response<AiMessage> response = model.generate(toChatMessages(messages));
        if (response == null || response.content() == null) {
            return "";
        }
        String text = response.content().text();
        return text == null ? "" : text;
    }

    @Override
    public String describe() {
        return "langchain4j:" + modelName;
    }

    static List<ChatMessage> toChatMessages(List<PromptMessage> messages) {
        List<ChatMessage> out = new ArrayList<>();
        if (messages == null) {
            return out;
        }
        for (PromptMessage m : messages) {
            if (m == null) {
                continue;
            }
            switch (m.role()) {
                case SYSTEM:
                    out.add(SystemMessage.from(m.content()));
                    break;
                case USER:
                default:
                    out.add(UserMessage.from(m.content()));
                    break;
            }
        }
        return out;
    }
}
