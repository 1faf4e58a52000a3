package com.pep.service.generation;

import lombok.Builder;
import lombok.Value;

/**
 * 单个服务商的调用参数
 */
@Value
@Builder
public class LlmClientSettings {

    String baseUrl;

    String model;

    String secretId;

    int maxTokens;

    double temperature;

    int maxAttempts;

    long connectTimeoutMs;

    long readTimeoutMs;

    long writeTimeoutMs;

    long callTimeoutMs;
}
