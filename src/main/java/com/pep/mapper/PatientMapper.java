package com.pep.mapper;

import com.pep.model.entity.Patient;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface PatientMapper {
    /**
     * 根据患者ID查询基本信息
     * @param patientId 患者ID
     * @return 患者，不存在时返回 null
     */
    Patient getById(String patientId);
}
