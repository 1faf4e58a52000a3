package com.pep.model.enums;

/**
 * 训练动作来源标记
 */
public enum ExerciseSource {

    TEMPLATE("system-template"),
    LLM_GENERATED("llm-generated"),
    PT_CREATED("pt-created");

    private final String code;

    ExerciseSource(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
