package com.pep.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成服务返回的训练动作提案
 * 视频字段只由视频补全环节填写，生成环节始终为空
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseProposal {

    private String name;

    private String description;

    @Builder.Default
    private List<String> targetJoints = new ArrayList<>();

    @Builder.Default
    private List<String> instructions = new ArrayList<>();

    private String videoUrl;

    private String videoThumbnail;
}
