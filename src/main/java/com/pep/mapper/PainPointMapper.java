package com.pep.mapper;

import com.pep.model.entity.PainPoint;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface PainPointMapper {
    /**
     * 查询患者的全部疼痛记录（按创建时间正序）
     * @param patientId 患者ID
     */
    List<PainPoint> selectByPatientId(String patientId);
}
