package com.pep.model.vo;

import com.pep.model.enums.RecommendationSource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 训练推荐结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseRecommendationVO {

    private String status = "success";

    private List<ExerciseVO> exercises;

    private RecommendationSource source;

    public static ExerciseRecommendationVO of(List<ExerciseVO> exercises, RecommendationSource source) {
        return new ExerciseRecommendationVO("success", exercises, source);
    }
}
