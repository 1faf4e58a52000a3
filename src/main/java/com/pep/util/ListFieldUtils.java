package com.pep.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表字段工具：目标关节、训练步骤既可能是数组，也可能是分隔字符串
 */
public final class ListFieldUtils {

    public static final String JOINT_DELIMITER = ",";
    public static final String INSTRUCTION_DELIMITER = ";";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private ListFieldUtils() {
    }

    /**
     * 拆分分隔字符串，去掉空白项
     */
    public static List<String> split(String text, String delimiter) {
        if (StringUtils.isBlank(text)) {
            return new ArrayList<>();
        }
        List<String> result = new ArrayList<>();
        for (String part : StringUtils.splitByWholeSeparatorPreserveAllTokens(text, delimiter)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /**
     * 数组节点逐项取文本；文本节点按分隔符拆分；其他情况返回空列表
     */
    public static List<String> fromNode(JsonNode node, String delimiter) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new ArrayList<>();
        }
        if (node.isTextual()) {
            return split(node.asText(), delimiter);
        }
        List<String> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = item.isTextual() ? item.asText().trim() : item.toString();
                if (StringUtils.isNotBlank(value)) {
                    result.add(value);
                }
            }
        }
        return result;
    }

    /**
     * 去掉空白项并 trim，入库前统一调用
     */
    public static List<String> normalize(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                result.add(value.trim());
            }
        }
        return result;
    }

    /**
     * List -> JSON String
     */
    public static String toJson(ObjectMapper objectMapper, List<String> list) throws JsonProcessingException {
        return objectMapper.writeValueAsString(list == null ? Collections.emptyList() : list);
    }

    /**
     * JSON String -> List，历史数据中的分隔字符串同样兼容
     */
    public static List<String> fromJson(ObjectMapper objectMapper, String json, String delimiter) {
        if (StringUtils.isBlank(json)) {
            return Collections.emptyList();
        }
        String trimmed = json.trim();
        if (!trimmed.startsWith("[")) {
            return split(trimmed, delimiter);
        }
        try {
            return objectMapper.readValue(trimmed, STRING_LIST);
        } catch (JsonProcessingException e) {
            return split(trimmed, delimiter);
        }
    }
}
