package com.pep.service.manager;

import com.pep.model.dto.PatientProfile;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prompt 模板管理器
 * 职责：管理 System/User Prompt 模板，负责将患者画像渲染成最终字符串
 */
@Component
public class PromptTemplateManager {

    static final String NO_PAIN_POINTS = "No specific pain points mentioned.";
    private static final String DEFAULT_NAME = "the patient";
    private static final String DEFAULT_AGE = "unknown age";
    private static final String DEFAULT_FREQUENCY = "daily";
    private static final String DEFAULT_PAIN = "knee pain";
    private static final int DEFAULT_SEVERITY = 5;

    // ================= System Prompt (人设) =================

    private static final String SYSTEM_PROMPT = "You are a senior physical therapist specializing in knee rehabilitation.";

    // ================= User Prompt (画像 + 输出规范) =================

    private static final String USER_PROMPT_TEMPLATE = """
            I need to generate personalized knee rehabilitation exercises for a patient with the following profile:

            Name: %s
            Age: %s
            Exercise frequency: %s
            %s

            Please provide 3-5 evidence-based exercises appropriate for knee rehabilitation for this specific patient.
            Consider standard physical therapy protocols and clinical practice guidelines.

            For each exercise, include:
            1. A clear name
            2. A concise description
            3. Target joints (list)
            4. Step-by-step instructions (list)

            Do not include any video links.

            Format your response as JSON according to this structure:
            [
              {
                "name": "Exercise Name",
                "description": "Brief description of the exercise",
                "target_joints": ["knee", "ankle"],
                "instructions": ["Step 1", "Step 2", "Step 3"]
              }
            ]

            Respond ONLY with the JSON array and nothing else.
            """;

    public String buildSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserPrompt(PatientProfile profile) {
        String name = StringUtils.defaultIfBlank(profile.getName(), DEFAULT_NAME);
        String age = profile.getAge() != null ? String.valueOf(profile.getAge()) : DEFAULT_AGE;
        String frequency = StringUtils.defaultIfBlank(profile.getExerciseFrequency(), DEFAULT_FREQUENCY);
        return String.format(USER_PROMPT_TEMPLATE, name, age, frequency, describePainPoints(profile));
    }

    /**
     * 疼痛描述，例："Pain points: Pain climbing stairs (severity: 7/10); ..."
     */
    String describePainPoints(PatientProfile profile) {
        if (profile.getPainPoints() == null || profile.getPainPoints().isEmpty()) {
            return NO_PAIN_POINTS;
        }
        return "Pain points: " + profile.getPainPoints().stream()
                .map(p -> String.format("%s (severity: %d/10)",
                        StringUtils.defaultIfBlank(p.getDescription(), DEFAULT_PAIN),
                        p.getSeverity() != null ? p.getSeverity() : DEFAULT_SEVERITY))
                .collect(Collectors.joining("; "));
    }
}
