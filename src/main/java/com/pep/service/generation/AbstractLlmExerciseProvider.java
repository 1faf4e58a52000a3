package com.pep.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pep.common.SecretStore;
import com.pep.exception.GenerationException;
import com.pep.model.dto.ExerciseProposal;
import com.pep.model.dto.PatientProfile;
import com.pep.service.manager.PromptTemplateManager;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 基于 OkHttp 的大模型调用骨架：渲染 Prompt -> 读取密钥 -> 调用接口 -> 解析动作数组
 * 子类只负责各自的请求体、鉴权头和响应结构
 */
@Slf4j
public abstract class AbstractLlmExerciseProvider implements ExerciseGenerationProvider {

    protected static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json; charset=utf-8");

    protected final LlmClientSettings settings;
    protected final ObjectMapper objectMapper;

    private final OkHttpClient httpClient;
    private final SecretStore secretStore;
    private final PromptTemplateManager promptTemplateManager;
    private final ExerciseProposalParser parser;

    protected AbstractLlmExerciseProvider(LlmClientSettings settings,
                                          OkHttpClient httpClient,
                                          SecretStore secretStore,
                                          ObjectMapper objectMapper,
                                          PromptTemplateManager promptTemplateManager,
                                          ExerciseProposalParser parser) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.secretStore = secretStore;
        this.objectMapper = objectMapper;
        this.promptTemplateManager = promptTemplateManager;
        this.parser = parser;
        log.info("{} 初始化完成，使用 baseUrl={}, model={}", provider(), settings.getBaseUrl(), settings.getModel());
    }

    protected static OkHttpClient buildHttpClient(LlmClientSettings settings) {
        return new OkHttpClient.Builder()
                .connectTimeout(settings.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(settings.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .writeTimeout(settings.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)
                .callTimeout(settings.getCallTimeoutMs(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    public List<ExerciseProposal> generate(PatientProfile profile) {
        String systemPrompt = promptTemplateManager.buildSystemPrompt();
        String userPrompt = promptTemplateManager.buildUserPrompt(profile);
        log.info("调用 {} 生成训练动作，patientId={}, 疼痛记录数={}",
                provider(), profile.getPatientId(), profile.getPainPoints().size());

        String rawResponse = chat(systemPrompt, userPrompt);
        List<ExerciseProposal> proposals = parser.parse(rawResponse);

        log.info("{} 返回 {} 个训练动作，patientId={}", provider(), proposals.size(), profile.getPatientId());
        return proposals;
    }

    /**
     * 请求体（已包含 model / temperature / max_tokens）
     */
    protected abstract Map<String, Object> buildPayload(String systemPrompt, String userPrompt);

    /**
     * 在 Request.Builder 上补充鉴权头
     */
    protected abstract Request.Builder authorize(Request.Builder builder, String apiKey);

    /**
     * 从成功响应中取出模型输出文本，取不到时返回 null
     */
    protected abstract String extractContent(JsonNode root);

    String chat(String systemPrompt, String userPrompt) {
        // 密钥每次调用都重新读取
        String apiKey = secretStore.get(settings.getSecretId());
        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(buildPayload(systemPrompt, userPrompt));
        } catch (JsonProcessingException e) {
            throw new GenerationException("构建 " + provider() + " 请求体失败: " + e.getMessage(), e);
        }
        int maxAttempts = Math.max(settings.getMaxAttempts(), 1);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Request request = authorize(new Request.Builder(), apiKey)
                    .url(settings.getBaseUrl())
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                String responseText = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    log.error("调用 {} 失败，code={}, body={}", provider(), response.code(), responseText);
                    throw new GenerationException("调用 " + provider() + " 失败，HTTP " + response.code());
                }
                return parseContent(responseText);
            } catch (InterruptedIOException timeout) {
                log.warn("调用 {} 超时，attempt={}/{}", provider(), attempt, maxAttempts);
                if (attempt >= maxAttempts) {
                    throw new GenerationException("调用 " + provider() + " 超时", timeout);
                }
                pause(attempt);
            } catch (IOException e) {
                log.error("调用 {} 异常", provider(), e);
                throw new GenerationException("调用 " + provider() + " 异常: " + e.getMessage(), e);
            }
        }
        throw new GenerationException("调用 " + provider() + " 异常: 未知错误");
    }

    String parseContent(String responseText) throws IOException {
        if (StringUtils.isBlank(responseText)) {
            throw new GenerationException(provider() + " 返回内容为空");
        }
        JsonNode root = objectMapper.readTree(responseText);
        JsonNode errorNode = root.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String errorMessage = errorNode.has("message") ? errorNode.get("message").asText() : errorNode.toString();
            throw new GenerationException(provider() + " 返回错误：" + errorMessage);
        }
        String content = extractContent(root);
        if (StringUtils.isBlank(content)) {
            throw new GenerationException(provider() + " 未返回有效内容");
        }
        return content;
    }

    private void pause(int attempt) {
        try {
            Thread.sleep(300L * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GenerationException("调用 " + provider() + " 被中断", ie);
        }
    }
}
