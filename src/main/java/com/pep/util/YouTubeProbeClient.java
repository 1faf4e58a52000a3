package com.pep.util;

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
import java.util.concurrent.TimeUnit;

/**
 * 视频存在性探测：通过 YouTube oEmbed 接口判断视频是否可用
 */
@Slf4j
@Component
public class YouTubeProbeClient {

    private static final String DEFAULT_OEMBED_URL = "https://www.youtube.com/oembed";

    private final OkHttpClient httpClient;
    private final String oembedUrl;

    @Autowired
    public YouTubeProbeClient(@Value("${pep.video.probe.oembed-url:" + DEFAULT_OEMBED_URL + "}") String oembedUrl,
                              @Value("${pep.video.probe.timeout-ms:5000}") long timeoutMs) {
        this(new OkHttpClient.Builder()
                        .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .build(),
                oembedUrl);
    }

    YouTubeProbeClient(OkHttpClient httpClient, String oembedUrl) {
        this.httpClient = httpClient;
        this.oembedUrl = StringUtils.defaultIfBlank(oembedUrl, DEFAULT_OEMBED_URL);
    }

    /**
     * @param videoId 11 位视频ID
     * @return 仅当探测接口返回 200 时为 true；网络异常、超时同样视为不可用
     */
    public boolean exists(String videoId) {
        HttpUrl base = HttpUrl.parse(oembedUrl);
        if (base == null || StringUtils.isBlank(videoId)) {
            return false;
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("url", YouTubeUrlUtils.watchUrl(videoId))
                .addQueryParameter("format", "json")
                .build();
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                log.debug("视频探测未通过，videoId={}, code={}", videoId, response.code());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("视频探测异常，videoId={}: {}", videoId, e.getMessage());
            return false;
        }
    }
}
