package com.pep.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pep.exception.GenerationParseException;
import com.pep.model.dto.ExerciseProposal;
import com.pep.util.ListFieldUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析模型返回的自由文本，提取训练动作数组
 * 允许 ```json 代码块包裹；target_joints / instructions 为字符串时按分隔符拆分
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExerciseProposalParser {

    public static final int MIN_PROPOSALS = 3;
    public static final int MAX_PROPOSALS = 5;

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public List<ExerciseProposal> parse(String rawResponse) {
        JsonNode root = readJsonArray(rawResponse);
        if (root.size() < MIN_PROPOSALS) {
            throw new GenerationParseException("生成结果数量不足，期望 " + MIN_PROPOSALS + "-" + MAX_PROPOSALS
                    + " 个，实际 " + root.size() + " 个");
        }
        if (root.size() > MAX_PROPOSALS) {
            log.warn("生成结果超过上限，截取前 {} 个，实际 {} 个", MAX_PROPOSALS, root.size());
        }

        List<ExerciseProposal> proposals = new ArrayList<>();
        for (int i = 0; i < root.size() && proposals.size() < MAX_PROPOSALS; i++) {
            proposals.add(toProposal(root.get(i), i));
        }
        return proposals;
    }

    /**
     * 优先取代码块内容；依次尝试每个 '['，取第一个能解析为对象数组的位置（数组之后的文字忽略）
     * 都不满足时按第一个 '[' 的解析结果报错
     */
    JsonNode readJsonArray(String text) {
        if (StringUtils.isBlank(text)) {
            throw new GenerationParseException("生成服务返回内容为空");
        }
        String candidate = text.trim();
        Matcher fenced = FENCED_BLOCK.matcher(candidate);
        if (fenced.find()) {
            candidate = fenced.group(1).trim();
        }

        JsonNode firstArray = null;
        JsonProcessingException firstError = null;
        boolean first = true;
        for (int start = candidate.indexOf('['); start >= 0; start = candidate.indexOf('[', start + 1)) {
            try {
                JsonNode node = objectMapper.readTree(candidate.substring(start));
                if (isObjectArray(node)) {
                    return node;
                }
                if (first && node != null && node.isArray()) {
                    firstArray = node;
                }
            } catch (JsonProcessingException e) {
                if (first) {
                    firstError = e;
                }
            }
            first = false;
        }

        if (firstArray != null) {
            return firstArray;
        }
        if (firstError != null) {
            throw new GenerationParseException("生成结果不是合法 JSON: " + firstError.getOriginalMessage(), firstError);
        }
        throw new GenerationParseException("生成结果中未找到 JSON 数组");
    }

    private static boolean isObjectArray(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return false;
        }
        for (JsonNode element : node) {
            if (!element.isObject()) {
                return false;
            }
        }
        return true;
    }

    private ExerciseProposal toProposal(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new GenerationParseException("第 " + (index + 1) + " 个动作不是 JSON 对象");
        }
        String name = node.path("name").asText("").trim();
        if (name.isEmpty()) {
            throw new GenerationParseException("第 " + (index + 1) + " 个动作缺少 name");
        }
        // video_url 即使返回也忽略，视频只由补全环节决定
        return ExerciseProposal.builder()
                .name(name)
                .description(node.path("description").asText("").trim())
                .targetJoints(ListFieldUtils.fromNode(node.get("target_joints"), ListFieldUtils.JOINT_DELIMITER))
                .instructions(ListFieldUtils.fromNode(node.get("instructions"), ListFieldUtils.INSTRUCTION_DELIMITER))
                .build();
    }
}
