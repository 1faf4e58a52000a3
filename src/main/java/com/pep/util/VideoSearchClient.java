package com.pep.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pep.common.SecretStore;
import com.pep.exception.EnrichmentException;
import com.pep.model.dto.VideoSearchResult;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 视频检索客户端（SerpApi YouTube 引擎）
 */
@Slf4j
@Component
public class VideoSearchClient {

    private static final String DEFAULT_BASE_URL = "https://serpapi.com/search.json";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SecretStore secretStore;
    private final String baseUrl;
    private final String secretId;
    private final int maxResults;

    @Autowired
    public VideoSearchClient(@Value("${pep.video.search.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
                             @Value("${pep.video.search.secret-id:serpapi-api-key}") String secretId,
                             @Value("${pep.video.search.max-results:5}") int maxResults,
                             @Value("${pep.video.search.timeout-ms:8000}") long timeoutMs,
                             SecretStore secretStore,
                             ObjectMapper objectMapper) {
        this(new OkHttpClient.Builder()
                        .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .build(),
                baseUrl, secretId, maxResults, secretStore, objectMapper);
    }

    VideoSearchClient(OkHttpClient httpClient,
                      String baseUrl,
                      String secretId,
                      int maxResults,
                      SecretStore secretStore,
                      ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.baseUrl = StringUtils.defaultIfBlank(baseUrl, DEFAULT_BASE_URL);
        this.secretId = secretId;
        this.maxResults = Math.max(maxResults, 1);
        this.secretStore = secretStore;
        this.objectMapper = objectMapper;
    }

    /**
     * 按检索词查询视频，结果保持服务端排序
     *
     * @throws EnrichmentException 网络异常、超时、非 2xx 或响应无法解析
     */
    public List<VideoSearchResult> search(String query) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new EnrichmentException("视频检索地址非法: " + baseUrl);
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("engine", "youtube")
                .addQueryParameter("search_query", query)
                .addQueryParameter("api_key", secretStore.get(secretId))
                .build();
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new EnrichmentException("视频检索失败，HTTP " + response.code());
            }
            String body = response.body() != null ? response.body().string() : "";
            return parseResults(body);
        } catch (IOException e) {
            throw new EnrichmentException("视频检索异常: " + e.getMessage(), e);
        }
    }

    List<VideoSearchResult> parseResults(String body) throws IOException {
        List<VideoSearchResult> results = new ArrayList<>();
        if (StringUtils.isBlank(body)) {
            return results;
        }
        JsonNode root = objectMapper.readTree(body);
        if (root.hasNonNull("error")) {
            throw new EnrichmentException("视频检索返回错误：" + root.get("error").asText());
        }
        for (JsonNode item : root.path("video_results")) {
            if (results.size() >= maxResults) {
                break;
            }
            String link = item.path("link").asText(null);
            if (StringUtils.isBlank(link)) {
                continue;
            }
            results.add(new VideoSearchResult(link.trim(), readThumbnail(item.path("thumbnail"))));
        }
        return results;
    }

    /**
     * thumbnail 可能是字符串，也可能是 {"static": ..., "rich": ...}
     */
    private static String readThumbnail(JsonNode node) {
        if (node.isTextual()) {
            return StringUtils.trimToNull(node.asText());
        }
        if (node.isObject()) {
            return StringUtils.trimToNull(node.path("static").asText(null));
        }
        return null;
    }
}
