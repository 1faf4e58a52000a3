package com.pep.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class PainPoint {
    private String id;

    /**
     * 关联患者id
     */
    private String patientId;

    /**
     * 疼痛描述，例如：上楼梯时髌骨后方疼痛
     */
    private String description;

    /**
     * 严重程度 1-10
     */
    private Integer severity;

    private LocalDateTime createdAt;
}
