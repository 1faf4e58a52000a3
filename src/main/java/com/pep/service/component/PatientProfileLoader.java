package com.pep.service.component;

import com.pep.exception.PatientNotFoundException;
import com.pep.mapper.PainPointMapper;
import com.pep.mapper.PatientMapper;
import com.pep.model.dto.PatientProfile;
import com.pep.model.entity.PainPoint;
import com.pep.model.entity.Patient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 读取患者基本信息及疼痛记录，无副作用
 */
@Component
@RequiredArgsConstructor
public class PatientProfileLoader {

    private final PatientMapper patientMapper;
    private final PainPointMapper painPointMapper;

    public PatientProfile load(String patientId) {
        Patient patient = patientMapper.getById(patientId);
        if (patient == null) {
            throw new PatientNotFoundException("Patient not found: " + patientId);
        }
        List<PainPoint> painPoints = painPointMapper.selectByPatientId(patientId);

        PatientProfile.PatientProfileBuilder builder = PatientProfile.builder()
                .patientId(patient.getId())
                .name(patient.getName())
                .age(patient.getAge())
                .exerciseFrequency(patient.getExerciseFrequency());
        if (painPoints != null) {
            for (PainPoint p : painPoints) {
                builder.painPoint(new PatientProfile.Pain(p.getDescription(), p.getSeverity()));
            }
        }
        return builder.build();
    }
}
