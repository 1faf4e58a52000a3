package com.pep.controller;

import com.pep.model.dto.GenerateExercisesRequestDTO;
import com.pep.model.vo.ExerciseRecommendationVO;
import com.pep.service.ExerciseRecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 康复训练相关接口
 */
@Slf4j
@RestController
@RequestMapping("/api/exercises")
@RequiredArgsConstructor
public class ExerciseController {

    private final ExerciseRecommendationService exerciseRecommendationService;

    /**
     * 为患者生成（或直接返回已有的）个性化训练动作
     */
    @PostMapping("/generate")
    public ExerciseRecommendationVO generate(@RequestBody(required = false) GenerateExercisesRequestDTO request) {
        log.info("收到训练推荐请求，patientId={}, provider={}",
                request != null ? request.getPatientId() : null,
                request != null ? request.getProvider() : null);
        return exerciseRecommendationService.recommend(request);
    }
}
