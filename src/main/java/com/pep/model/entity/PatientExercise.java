package com.pep.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 患者与训练动作的关联（处方）
 */
@Data
public class PatientExercise {
    private String id;

    private String patientId;

    private String exerciseId;

    /**
     * 推荐时间
     */
    private LocalDateTime recommendedAt;

    /**
     * 是否被康复师调整过
     */
    private Boolean ptModified;

    /**
     * 调整处方的康复师id，可为空
     */
    private String ptId;

    /**
     * 训练频率
     */
    private String frequency;

    /**
     * 组数
     */
    private Integer sets;

    /**
     * 每组次数
     */
    private Integer repetitions;

    private String notes;
}
