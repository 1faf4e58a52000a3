package com.pep.service.generation;

import com.pep.model.dto.ExerciseProposal;
import com.pep.model.dto.PatientProfile;
import com.pep.model.enums.LlmProvider;

import java.util.List;

/**
 * 训练动作生成服务商
 * 不同实现只在对接的外部接口协议上不同，输入输出约定一致
 */
public interface ExerciseGenerationProvider {

    LlmProvider provider();

    /**
     * 根据患者画像生成 3-5 个训练动作提案（不含视频字段）
     *
     * @param profile 已加载疼痛记录的患者画像
     * @return 按模型返回顺序排列的提案
     * @throws com.pep.exception.GenerationException 传输失败、非成功状态、空响应或解析失败
     */
    List<ExerciseProposal> generate(PatientProfile profile);
}
