package com.pep.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 单次流水线运行内的患者画像快照，加载后不可变
 */
@Value
@Builder
public class PatientProfile {

    String patientId;

    String name;

    Integer age;

    String exerciseFrequency;

    @Singular
    List<Pain> painPoints;

    @Value
    public static class Pain {
        String description;
        Integer severity;
    }
}
