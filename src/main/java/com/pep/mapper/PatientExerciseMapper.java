package com.pep.mapper;

import com.pep.model.entity.PatientExercise;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface PatientExerciseMapper {
    /**
     * 查询患者的全部训练关联（按推荐时间正序）
     * @param patientId 患者ID
     */
    List<PatientExercise> selectByPatientId(String patientId);

    /**
     * 新增关联
     * @param link
     */
    int insert(PatientExercise link);
}
