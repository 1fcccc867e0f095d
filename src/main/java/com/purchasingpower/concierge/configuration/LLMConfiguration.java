package com.purchasingpower.concierge.configuration;

import com.purchasingpower.concierge.client.GenerativeTextService;
import com.purchasingpower.concierge.client.LangChain4jTextService;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Two tiers over the same Ollama model.
 *
 * <ul>
 *   <li>{@code deterministicTextService}: temperature 0, used for intent
 *       classification, the LLM safety gate and fact extraction.</li>
 *   <li>{@code responseTextService}: used for the user-facing reply.</li>
 * </ul>
 */
@Slf4j
@Configuration
public class LLMConfiguration {

    @Value("${app.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${app.ollama.chat-model:qwen2.5:7b}")
    private String ollamaChatModel;

    @Value("${app.ollama.timeout-seconds:60}")
    private int ollamaTimeoutSeconds;

    @Value("${app.ollama.max-retries:1}")
    private int ollamaMaxRetries;

    @Value("${app.ollama.response-temperature:0.7}")
    private double responseTemperature;

    @Bean("deterministicTextService")
    public GenerativeTextService deterministicTextService() {
        log.info("🔧 Initializing deterministic text service (Ollama - {})", ollamaChatModel);
        log.info("   - URL: {}", ollamaBaseUrl);
        log.info("   - Use case: classification, safety check, fact extraction");
        return new LangChain4jTextService(buildModel(0.0), "deterministic");
    }

    @Bean("responseTextService")
    public GenerativeTextService responseTextService() {
        log.info("🧠 Initializing response text service (Ollama - {}, temperature={})",
                ollamaChatModel, responseTemperature);
        return new LangChain4jTextService(buildModel(responseTemperature), "response");
    }

    private ChatLanguageModel buildModel(double temperature) {
        return OllamaChatModel.builder()
                .baseUrl(ollamaBaseUrl)
                .modelName(ollamaChatModel)
                .timeout(Duration.ofSeconds(ollamaTimeoutSeconds))
                .temperature(temperature)
                .maxRetries(ollamaMaxRetries)
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
