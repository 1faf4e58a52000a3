package com.pep.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pep.common.SecretStore;
import com.pep.model.enums.LlmProvider;
import com.pep.service.manager.PromptTemplateManager;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 服务商 A：Anthropic Messages API
 */
@Component
public class ClaudeExerciseProvider extends AbstractLlmExerciseProvider {

    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1/messages";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    @Autowired
    public ClaudeExerciseProvider(@Value("${pep.llm.claude.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
                                  @Value("${pep.llm.claude.model:claude-3-opus-20240229}") String model,
                                  @Value("${pep.llm.claude.secret-id:anthropic-api-key}") String secretId,
                                  @Value("${pep.llm.claude.max-tokens:2000}") int maxTokens,
                                  @Value("${pep.llm.claude.temperature:0.3}") double temperature,
                                  @Value("${pep.llm.claude.retry.max-attempts:1}") int maxAttempts,
                                  @Value("${pep.llm.claude.timeout.connect-ms:5000}") long connectTimeoutMs,
                                  @Value("${pep.llm.claude.timeout.read-ms:60000}") long readTimeoutMs,
                                  @Value("${pep.llm.claude.timeout.write-ms:20000}") long writeTimeoutMs,
                                  @Value("${pep.llm.claude.timeout.call-ms:90000}") long callTimeoutMs,
                                  SecretStore secretStore,
                                  ObjectMapper objectMapper,
                                  PromptTemplateManager promptTemplateManager,
                                  ExerciseProposalParser parser) {
        this(LlmClientSettings.builder()
                        .baseUrl(baseUrl)
                        .model(model)
                        .secretId(secretId)
                        .maxTokens(maxTokens)
                        .temperature(temperature)
                        .maxAttempts(maxAttempts)
                        .connectTimeoutMs(connectTimeoutMs)
                        .readTimeoutMs(readTimeoutMs)
                        .writeTimeoutMs(writeTimeoutMs)
                        .callTimeoutMs(callTimeoutMs)
                        .build(),
                secretStore, objectMapper, promptTemplateManager, parser);
    }

    private ClaudeExerciseProvider(LlmClientSettings settings,
                                   SecretStore secretStore,
                                   ObjectMapper objectMapper,
                                   PromptTemplateManager promptTemplateManager,
                                   ExerciseProposalParser parser) {
        this(settings, buildHttpClient(settings), secretStore, objectMapper, promptTemplateManager, parser);
    }

    ClaudeExerciseProvider(LlmClientSettings settings,
                           OkHttpClient httpClient,
                           SecretStore secretStore,
                           ObjectMapper objectMapper,
                           PromptTemplateManager promptTemplateManager,
                           ExerciseProposalParser parser) {
        super(settings, httpClient, secretStore, objectMapper, promptTemplateManager, parser);
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.CLAUDE;
    }

    @Override
    protected Map<String, Object> buildPayload(String systemPrompt, String userPrompt) {
        Map<String, String> user = new HashMap<>();
        user.put("role", "user");
        user.put("content", userPrompt);

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", settings.getModel());
        payload.put("max_tokens", settings.getMaxTokens());
        payload.put("temperature", settings.getTemperature());
        payload.put("system", systemPrompt);
        payload.put("messages", List.of(user));
        return payload;
    }

    @Override
    protected Request.Builder authorize(Request.Builder builder, String apiKey) {
        return builder
                .addHeader("x-api-key", apiKey)
                .addHeader("anthropic-version", ANTHROPIC_VERSION);
    }

    /**
     * content 为分段数组，拼接所有 text 段
     */
    @Override
    protected String extractContent(JsonNode root) {
        JsonNode content = root.path("content");
        if (!content.isArray() || content.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText("text")) && block.hasNonNull("text")) {
                text.append(block.get("text").asText());
            }
        }
        return text.toString();
    }
}
