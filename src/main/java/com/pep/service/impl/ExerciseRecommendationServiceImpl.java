package com.pep.service.impl;

import com.pep.exception.ValidationException;
import com.pep.model.dto.ExerciseProposal;
import com.pep.model.dto.GenerateExercisesRequestDTO;
import com.pep.model.dto.PatientProfile;
import com.pep.model.entity.Exercise;
import com.pep.model.enums.LlmProvider;
import com.pep.model.enums.RecommendationSource;
import com.pep.model.vo.ExerciseRecommendationVO;
import com.pep.service.ExerciseRecommendationService;
import com.pep.service.builder.ExerciseVOBuilder;
import com.pep.service.component.ExerciseCacheResolver;
import com.pep.service.component.ExercisePersistenceWriter;
import com.pep.service.component.PatientProfileLoader;
import com.pep.service.enrich.VideoEnrichmentService;
import com.pep.service.generation.ExerciseGenerationProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 康复训练推荐实现
 * 画像加载 -> 缓存判定 -> 生成 -> 视频补全 -> 去重落库，单线程顺序执行
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExerciseRecommendationServiceImpl implements ExerciseRecommendationService {

    private final PatientProfileLoader patientProfileLoader;
    private final ExerciseCacheResolver exerciseCacheResolver;
    private final ExerciseGenerationProviderRegistry providerRegistry;
    private final VideoEnrichmentService videoEnrichmentService;
    private final ExercisePersistenceWriter exercisePersistenceWriter;
    private final ExerciseVOBuilder exerciseVOBuilder;

    @Override
    public ExerciseRecommendationVO recommend(GenerateExercisesRequestDTO request) {
        // 1. 参数校验
        if (request == null || StringUtils.isBlank(request.getPatientId())) {
            throw new ValidationException("Invalid request - missing patient_id");
        }
        String patientId = request.getPatientId().trim();
        LlmProvider provider = LlmProvider.fromTag(request.getProvider())
                .orElseThrow(() -> new ValidationException("Invalid provider: " + request.getProvider()
                        + "，仅支持 A / B"));

        // 2. 画像与缓存判定
        PatientProfile profile = patientProfileLoader.load(patientId);
        List<Exercise> cached = exerciseCacheResolver.resolve(profile);
        if (exerciseCacheResolver.isHit(cached)) {
            log.info("命中已有训练动作，跳过生成，patientId={}, count={}", patientId, cached.size());
            return ExerciseRecommendationVO.of(exerciseVOBuilder.buildAll(cached), RecommendationSource.CACHE);
        }

        // 3. 生成 -> 视频补全 -> 落库
        List<ExerciseProposal> proposals = providerRegistry.get(provider).generate(profile);
        videoEnrichmentService.enrichAll(proposals);
        List<Exercise> saved = exercisePersistenceWriter.persist(patientId, proposals);

        log.info("训练动作生成完成，patientId={}, provider={}, count={}", patientId, provider, saved.size());
        return ExerciseRecommendationVO.of(exerciseVOBuilder.buildAll(saved), RecommendationSource.GENERATED);
    }
}
