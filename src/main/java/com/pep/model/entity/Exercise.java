package com.pep.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 训练动作库记录，name 全库唯一（去重键，区分大小写）
 */
@Data
public class Exercise {
    /**
     * 主键（UUID）
     */
    private String id;

    /**
     * 动作名称
     */
    private String name;

    private String description;

    /**
     * 目标关节，JSON 数组字符串
     */
    private String targetJoints;

    /**
     * 分步说明，JSON 数组字符串
     */
    private String instructions;

    /**
     * 演示视频地址，创建后最多回填一次
     */
    private String videoUrl;

    /**
     * 视频缩略图地址
     */
    private String videoThumbnail;

    /**
     * 来源标记，见 {@link com.pep.model.enums.ExerciseSource}
     */
    private String source;

    private LocalDateTime createdAt;
}
