package com.pep.model.enums;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Optional;

/**
 * 文本生成服务商
 * 请求中使用 "A" / "B" 选择，兼容旧客户端传入的 "claude" / "openai"
 */
public enum LlmProvider {

    CLAUDE("A", "claude"),
    OPENAI("B", "openai");

    private final String code;
    private final String alias;

    LlmProvider(String code, String alias) {
        this.code = code;
        this.alias = alias;
    }

    /**
     * 解析请求中的服务商标记，空值返回默认 A
     */
    public static Optional<LlmProvider> fromTag(String tag) {
        if (StringUtils.isBlank(tag)) {
            return Optional.of(CLAUDE);
        }
        String value = tag.trim();
        return Arrays.stream(values())
                .filter(p -> p.code.equalsIgnoreCase(value) || p.alias.equalsIgnoreCase(value))
                .findFirst();
    }
}
