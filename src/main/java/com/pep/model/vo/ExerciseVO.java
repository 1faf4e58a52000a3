package com.pep.model.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExerciseVO {

    private String id;

    private String name;

    private String description;

    private List<String> targetJoints;

    private List<String> instructions;

    private String videoUrl;

    private String videoThumbnail;

    /**
     * 来源标记 system-template / llm-generated / pt-created
     */
    private String source;

    private LocalDateTime createdAt;
}
