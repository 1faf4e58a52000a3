package com.pep.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class Patient {
    /**
     * 主键（UUID）
     */
    private String id;

    /**
     * 姓名
     */
    private String name;

    /**
     * 年龄
     */
    private Integer age;

    /**
     * 训练频率偏好（daily / 3x-weekly / weekly 等）
     */
    private String exerciseFrequency;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
