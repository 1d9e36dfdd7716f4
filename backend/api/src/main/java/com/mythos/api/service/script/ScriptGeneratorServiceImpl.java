package com.mythos.api.service.script;

import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.provider.ProviderException;
import com.mythos.api.service.provider.ScriptPrompt;
import com.mythos.common.enums.SceneCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ScriptGeneratorServiceImpl implements ScriptGeneratorService {

    private final GenerationProvider generationProvider;
    private final ScriptPromptBuilder promptBuilder;
    private final String primaryModel;
    private final String fallbackModel;

    public ScriptGeneratorServiceImpl(
            GenerationProvider generationProvider,
            ScriptPromptBuilder promptBuilder,
            @Value("${mythos.provider.script.primary-model:gpt-4o-mini}") String primaryModel,
            @Value("${mythos.provider.script.fallback-model:gpt-3.5-turbo}") String fallbackModel) {
        this.generationProvider = generationProvider;
        this.promptBuilder = promptBuilder;
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
    }

    @Override
    public ScriptCompletion generate(String scene, SceneCategory category) {
        ScriptPrompt prompt = promptBuilder.build(scene, category);

        try {
            log.info("[Script] Generating with model: {}, category: {}", primaryModel, category.getCode());
            String text = generationProvider.completeText(prompt, primaryModel);
            return ScriptCompletion.builder()
                    .rawText(text)
                    .model(primaryModel)
                    .fallbackModelUsed(false)
                    .build();
        } catch (ProviderException e) {
            if (!e.isModelNotFound()) {
                log.error("[Script] Generation failed with model {}: {}", primaryModel, e.getMessage());
                throw e;
            }
            log.warn("[Script] Primary model {} not available, falling back to {}", primaryModel, fallbackModel);
        }

        // fallback 실패는 그대로 전파 (재시도 없음)
        String text = generationProvider.completeText(prompt, fallbackModel);
        log.info("[Script] Fallback model {} succeeded", fallbackModel);
        return ScriptCompletion.builder()
                .rawText(text)
                .model(fallbackModel)
                .fallbackModelUsed(true)
                .build();
    }
}
