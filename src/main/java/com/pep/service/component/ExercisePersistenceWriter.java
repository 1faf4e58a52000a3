package com.pep.service.component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pep.exception.PersistenceException;
import com.pep.mapper.ExerciseMapper;
import com.pep.mapper.PatientExerciseMapper;
import com.pep.model.dto.ExerciseProposal;
import com.pep.model.entity.Exercise;
import com.pep.model.entity.PatientExercise;
import com.pep.model.enums.ExerciseSource;
import com.pep.util.ListFieldUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 训练动作落库：按名称去重，已存在的记录只回填空的视频字段；
 * 每个动作为患者新增一条默认处方关联
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExercisePersistenceWriter {

    static final String DEFAULT_FREQUENCY = "daily";
    static final int DEFAULT_SETS = 3;
    static final int DEFAULT_REPETITIONS = 10;

    private final ExerciseMapper exerciseMapper;
    private final PatientExerciseMapper patientExerciseMapper;
    private final ObjectMapper objectMapper;

    /**
     * 依次写入；任意一条失败即停止，之前已写入的记录不回滚
     *
     * @return 与提案顺序一致的动作记录
     */
    public List<Exercise> persist(String patientId, List<ExerciseProposal> proposals) {
        List<Exercise> saved = new ArrayList<>();
        for (ExerciseProposal proposal : proposals) {
            try {
                Exercise exercise = upsertExercise(proposal);
                linkToPatient(patientId, exercise.getId());
                saved.add(exercise);
            } catch (DataAccessException e) {
                log.error("保存训练动作失败，patientId={}, exercise={}, 已保存 {} 个", patientId, proposal.getName(), saved.size(), e);
                throw new PersistenceException("保存训练动作失败: " + proposal.getName(), e);
            }
        }
        log.info("训练动作保存完成，patientId={}, count={}", patientId, saved.size());
        return saved;
    }

    private Exercise upsertExercise(ExerciseProposal proposal) {
        Exercise existing = exerciseMapper.getByName(proposal.getName());
        if (existing != null) {
            return backfillMedia(existing, proposal);
        }

        Exercise created = newExercise(proposal);
        try {
            exerciseMapper.insert(created);
            return created;
        } catch (DuplicateKeyException race) {
            // 并发请求先插入了同名动作，改走回填
            Exercise winner = exerciseMapper.getByName(proposal.getName());
            if (winner == null) {
                throw race;
            }
            log.warn("同名动作已被并发写入，改为回填，name={}", proposal.getName());
            return backfillMedia(winner, proposal);
        }
    }

    /**
     * 只回填当前为空、且提案提供了非空值的字段
     * 更新由 SQL 条件保证不覆盖已有值，返回以库中实际记录为准
     */
    private Exercise backfillMedia(Exercise existing, ExerciseProposal proposal) {
        String videoUrl = fillable(existing.getVideoUrl(), proposal.getVideoUrl());
        String thumbnail = fillable(existing.getVideoThumbnail(), proposal.getVideoThumbnail());
        if (videoUrl == null && thumbnail == null) {
            return existing;
        }
        exerciseMapper.fillMediaIfEmpty(existing.getId(), videoUrl, thumbnail);
        // 并发请求可能已先填充，重新读取
        Exercise stored = exerciseMapper.getById(existing.getId());
        if (stored == null) {
            throw new PersistenceException("回填后未找到动作记录: " + existing.getId());
        }
        log.info("回填动作视频字段，exerciseId={}, videoUrl={}, thumbnail={}", stored.getId(),
                StringUtils.isNotEmpty(stored.getVideoUrl()), StringUtils.isNotEmpty(stored.getVideoThumbnail()));
        return stored;
    }

    private static String fillable(String stored, String proposed) {
        return StringUtils.isEmpty(stored) && StringUtils.isNotBlank(proposed) ? proposed : null;
    }

    private Exercise newExercise(ExerciseProposal proposal) {
        Exercise exercise = new Exercise();
        exercise.setId(UUID.randomUUID().toString());
        exercise.setName(proposal.getName());
        exercise.setDescription(StringUtils.defaultString(proposal.getDescription()));
        exercise.setTargetJoints(toJson(ListFieldUtils.normalize(proposal.getTargetJoints())));
        exercise.setInstructions(toJson(ListFieldUtils.normalize(proposal.getInstructions())));
        exercise.setVideoUrl(StringUtils.defaultString(proposal.getVideoUrl()));
        exercise.setVideoThumbnail(StringUtils.defaultString(proposal.getVideoThumbnail()));
        exercise.setSource(ExerciseSource.LLM_GENERATED.getCode());
        exercise.setCreatedAt(LocalDateTime.now());
        return exercise;
    }

    private void linkToPatient(String patientId, String exerciseId) {
        PatientExercise link = new PatientExercise();
        link.setId(UUID.randomUUID().toString());
        link.setPatientId(patientId);
        link.setExerciseId(exerciseId);
        link.setRecommendedAt(LocalDateTime.now());
        link.setPtModified(Boolean.FALSE);
        link.setPtId(null);
        link.setFrequency(DEFAULT_FREQUENCY);
        link.setSets(DEFAULT_SETS);
        link.setRepetitions(DEFAULT_REPETITIONS);
        link.setNotes("");
        patientExerciseMapper.insert(link);
    }

    private String toJson(List<String> values) {
        try {
            return ListFieldUtils.toJson(objectMapper, values);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("序列化列表字段失败", e);
        }
    }
}
