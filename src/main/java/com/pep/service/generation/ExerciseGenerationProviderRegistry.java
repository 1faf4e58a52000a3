package com.pep.service.generation;

import com.pep.model.enums.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按服务商标记选择生成实现
 */
@Slf4j
@Component
public class ExerciseGenerationProviderRegistry {

    private final Map<LlmProvider, ExerciseGenerationProvider> providers = new EnumMap<>(LlmProvider.class);

    public ExerciseGenerationProviderRegistry(List<ExerciseGenerationProvider> providers) {
        for (ExerciseGenerationProvider provider : providers) {
            ExerciseGenerationProvider previous = this.providers.put(provider.provider(), provider);
            if (previous != null) {
                throw new IllegalStateException("服务商 " + provider.provider() + " 存在多个实现");
            }
        }
        log.info("已注册生成服务商: {}", this.providers.keySet());
    }

    public ExerciseGenerationProvider get(LlmProvider provider) {
        ExerciseGenerationProvider found = providers.get(provider);
        if (found == null) {
            throw new IllegalStateException("未注册的生成服务商: " + provider);
        }
        return found;
    }
}
