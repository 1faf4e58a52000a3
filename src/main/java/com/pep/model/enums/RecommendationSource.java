package com.pep.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 推荐结果来源：命中已有数据 / 新生成
 */
public enum RecommendationSource {

    CACHE("cache"),
    GENERATED("generated");

    private final String value;

    RecommendationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
