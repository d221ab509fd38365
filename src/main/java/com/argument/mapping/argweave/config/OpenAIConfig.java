package com.argument.mapping.argweave.config;

import com.argument.mapping.argweave.service.llm.ClaimSynthesizer;
import com.argument.mapping.argweave.service.llm.LlmClaimSynthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OpenAI chat model used for synthetic intermediate claims.
 * Only active when synthetic rewiring is switched on, so the service runs without an API key otherwise.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "argweave.synthetic", name = "enabled", havingValue = "true")
public class OpenAIConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.model.chat:gpt-4o-mini}")
    private String chatModel;

    @Value("${openai.timeout:60}")
    private int timeoutSeconds;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Value("${argweave.synthetic.max-claim-words:20}")
    private int maxClaimWords;

    @Bean
    public ChatLanguageModel chatLanguageModel() {
        log.info("[OpenAI Config] Initializing ChatLanguageModel with model: {}", chatModel);

        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(chatModel)
                .temperature(0.3) // Low temperature: summaries, not creative writing
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .maxTokens(300)
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Bean
    public ClaimSynthesizer claimSynthesizer(ChatLanguageModel chatLanguageModel, ObjectMapper objectMapper) {
        return new LlmClaimSynthesizer(chatLanguageModel, objectMapper, maxClaimWords);
    }
}
