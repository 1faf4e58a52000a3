package com.pep.service;

import com.pep.model.dto.GenerateExercisesRequestDTO;
import com.pep.model.vo.ExerciseRecommendationVO;

/**
 * 康复训练推荐服务
 */
public interface ExerciseRecommendationService {

    /**
     * 为患者推荐训练动作：已有数据足够时直接返回，否则调用生成服务并补全演示视频后落库
     *
     * @param request 患者ID与生成服务商
     * @return 推荐结果，source 为 cache 或 generated
     */
    ExerciseRecommendationVO recommend(GenerateExercisesRequestDTO request);
}
