package com.pep.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 生成康复训练请求参数
 */
@Data
public class GenerateExercisesRequestDTO {

    @JsonProperty("patient_id")
    private String patientId;

    /**
     * 文本生成服务商："A" / "B"，为空时默认 A
     */
    @JsonProperty("provider")
    @JsonAlias("llm_provider")
    private String provider;
}
