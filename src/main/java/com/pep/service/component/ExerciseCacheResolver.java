package com.pep.service.component;

import com.pep.mapper.ExerciseMapper;
import com.pep.mapper.PatientExerciseMapper;
import com.pep.model.dto.PatientProfile;
import com.pep.model.entity.Exercise;
import com.pep.model.entity.PatientExercise;
import com.pep.model.enums.ExerciseSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 判断已有数据能否直接满足本次推荐，不调用任何生成或视频服务
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExerciseCacheResolver {

    public static final int CACHE_HIT_THRESHOLD = 3;
    static final int TEMPLATE_FALLBACK_LIMIT = 5;

    private final PatientExerciseMapper patientExerciseMapper;
    private final ExerciseMapper exerciseMapper;

    /**
     * 1. 患者已关联的不同动作 >= 3 个：直接返回
     * 2. 否则无疼痛记录：返回空
     * 3. 否则返回最多 5 个模板动作
     *
     * @param profile 本次请求已加载的患者画像，疼痛记录直接取自画像
     */
    public List<Exercise> resolve(PatientProfile profile) {
        String patientId = profile.getPatientId();
        List<Exercise> linked = findLinkedExercises(patientId);
        if (linked.size() >= CACHE_HIT_THRESHOLD) {
            log.info("患者已有 {} 个关联动作，patientId={}", linked.size(), patientId);
            return linked;
        }

        if (profile.getPainPoints().isEmpty()) {
            return Collections.emptyList();
        }

        // TODO 模板动作目前未按疼痛描述筛选，匹配规则确定后再补充
        List<Exercise> templates = exerciseMapper.selectBySource(ExerciseSource.TEMPLATE.getCode(), TEMPLATE_FALLBACK_LIMIT);
        return templates != null ? templates : Collections.emptyList();
    }

    public boolean isHit(List<Exercise> resolved) {
        return resolved != null && resolved.size() >= CACHE_HIT_THRESHOLD;
    }

    /**
     * 关联表允许同一动作多次推荐，这里按动作去重并保持首次推荐顺序
     */
    private List<Exercise> findLinkedExercises(String patientId) {
        List<PatientExercise> links = patientExerciseMapper.selectByPatientId(patientId);
        if (links == null || links.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> exerciseIds = new LinkedHashSet<>();
        for (PatientExercise link : links) {
            exerciseIds.add(link.getExerciseId());
        }
        List<Exercise> found = exerciseMapper.selectByIds(new ArrayList<>(exerciseIds));
        if (found == null || found.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, Exercise> byId = new LinkedHashMap<>();
        for (Exercise exercise : found) {
            byId.put(exercise.getId(), exercise);
        }
        List<Exercise> ordered = new ArrayList<>();
        for (String id : exerciseIds) {
            Exercise exercise = byId.get(id);
            if (exercise != null) {
                ordered.add(exercise);
            }
        }
        return ordered;
    }
}
