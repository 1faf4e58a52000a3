package com.pep.service.builder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pep.model.entity.Exercise;
import com.pep.model.vo.ExerciseVO;
import com.pep.util.ListFieldUtils;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Entity -> VO
 */
@Component
@RequiredArgsConstructor
public class ExerciseVOBuilder {

    private final ObjectMapper objectMapper;

    public ExerciseVO build(Exercise entity) {
        ExerciseVO vo = new ExerciseVO();
        vo.setId(entity.getId());
        vo.setName(entity.getName());
        vo.setDescription(entity.getDescription());
        // JSON -> List
        vo.setTargetJoints(ListFieldUtils.fromJson(objectMapper, entity.getTargetJoints(), ListFieldUtils.JOINT_DELIMITER));
        vo.setInstructions(ListFieldUtils.fromJson(objectMapper, entity.getInstructions(), ListFieldUtils.INSTRUCTION_DELIMITER));
        vo.setVideoUrl(StringUtils.defaultString(entity.getVideoUrl()));
        vo.setVideoThumbnail(StringUtils.defaultString(entity.getVideoThumbnail()));
        vo.setSource(entity.getSource());
        vo.setCreatedAt(entity.getCreatedAt());
        return vo;
    }

    public List<ExerciseVO> buildAll(List<Exercise> entities) {
        return entities.stream().map(this::build).collect(Collectors.toList());
    }
}
