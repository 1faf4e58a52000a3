package com.pep.common;

import com.pep.exception.SecretUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 从 Spring 配置（pep.secrets.*）或环境变量读取密钥
 * 例：anthropic-api-key 依次查找 pep.secrets.anthropic-api-key、ANTHROPIC_API_KEY
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentSecretStore implements SecretStore {

    private static final String PROPERTY_PREFIX = "pep.secrets.";

    private final Environment environment;

    @Override
    public String get(String secretId) {
        if (StringUtils.isBlank(secretId)) {
            throw new SecretUnavailableException("密钥标识不能为空");
        }
        String value = StringUtils.firstNonBlank(
                environment.getProperty(PROPERTY_PREFIX + secretId),
                System.getenv(toEnvName(secretId)));
        if (StringUtils.isBlank(value)) {
            log.error("未配置密钥 {}", secretId);
            throw new SecretUnavailableException("未配置密钥 " + secretId
                    + "，请设置 " + PROPERTY_PREFIX + secretId + " 或环境变量 " + toEnvName(secretId));
        }
        return value.trim();
    }

    static String toEnvName(String secretId) {
        return secretId.trim().replace('-', '_').replace('.', '_').toUpperCase(Locale.ROOT);
    }
}
