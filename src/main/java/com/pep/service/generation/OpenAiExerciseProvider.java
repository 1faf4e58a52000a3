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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 服务商 B：OpenAI Chat Completions API
 */
@Component
public class OpenAiExerciseProvider extends AbstractLlmExerciseProvider {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1/chat/completions";

    @Autowired
    public OpenAiExerciseProvider(@Value("${pep.llm.openai.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
                                  @Value("${pep.llm.openai.model:gpt-4}") String model,
                                  @Value("${pep.llm.openai.secret-id:openai-api-key}") String secretId,
                                  @Value("${pep.llm.openai.max-tokens:2000}") int maxTokens,
                                  @Value("${pep.llm.openai.temperature:0.3}") double temperature,
                                  @Value("${pep.llm.openai.retry.max-attempts:1}") int maxAttempts,
                                  @Value("${pep.llm.openai.timeout.connect-ms:5000}") long connectTimeoutMs,
                                  @Value("${pep.llm.openai.timeout.read-ms:60000}") long readTimeoutMs,
                                  @Value("${pep.llm.openai.timeout.write-ms:20000}") long writeTimeoutMs,
                                  @Value("${pep.llm.openai.timeout.call-ms:90000}") long callTimeoutMs,
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

    private OpenAiExerciseProvider(LlmClientSettings settings,
                                   SecretStore secretStore,
                                   ObjectMapper objectMapper,
                                   PromptTemplateManager promptTemplateManager,
                                   ExerciseProposalParser parser) {
        this(settings, buildHttpClient(settings), secretStore, objectMapper, promptTemplateManager, parser);
    }

    OpenAiExerciseProvider(LlmClientSettings settings,
                           OkHttpClient httpClient,
                           SecretStore secretStore,
                           ObjectMapper objectMapper,
                           PromptTemplateManager promptTemplateManager,
                           ExerciseProposalParser parser) {
        super(settings, httpClient, secretStore, objectMapper, promptTemplateManager, parser);
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.OPENAI;
    }

    @Override
    protected Map<String, Object> buildPayload(String systemPrompt, String userPrompt) {
        List<Map<String, String>> messages = new ArrayList<>();
        Map<String, String> system = new HashMap<>();
        system.put("role", "system");
        system.put("content", systemPrompt);
        messages.add(system);
        Map<String, String> user = new HashMap<>();
        user.put("role", "user");
        user.put("content", userPrompt);
        messages.add(user);

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", settings.getModel());
        payload.put("messages", messages);
        payload.put("temperature", settings.getTemperature());
        payload.put("max_tokens", settings.getMaxTokens());
        return payload;
    }

    @Override
    protected Request.Builder authorize(Request.Builder builder, String apiKey) {
        return builder.addHeader("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected String extractContent(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return null;
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            return null;
        }
        return content.asText();
    }
}
