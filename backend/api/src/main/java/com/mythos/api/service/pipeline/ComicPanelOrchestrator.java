package com.mythos.api.service.pipeline;

import com.mythos.api.dto.PanelDto;
import com.mythos.api.service.evaluation.EvaluationOutcome;
import com.mythos.api.service.image.ImageGeneratorService;
import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.provider.ProviderErrorType;
import com.mythos.api.service.provider.ProviderException;
import com.mythos.api.service.provider.ProviderMode;
import com.mythos.api.service.provider.SyntheticScript;
import com.mythos.api.service.quality.QualityValidationService;
import com.mythos.api.service.quality.QualityVerdict;
import com.mythos.api.service.ratelimit.AdmissionDecision;
import com.mythos.api.service.ratelimit.RateLimitService;
import com.mythos.api.service.safety.AccuracyCheck;
import com.mythos.api.service.safety.ContentSafetyService;
import com.mythos.api.service.safety.SafetyContext;
import com.mythos.api.service.safety.SafetyVerdict;
import com.mythos.api.service.script.GeneratedScript;
import com.mythos.api.service.script.ScriptGeneratorService;
import com.mythos.api.service.script.ScriptParser;
import com.mythos.common.enums.ErrorType;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import com.mythos.common.prompt.CharacterProfile;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 만화 패널 생성 파이프라인
 *
 * 0. 장면 검증 (빈 값, 단어 수) - rate limit 카운트 전
 * 1. 스크립트 rate limit
 * 2. 입력 안전성 검사 (평가기 오류 시 fail-open)
 * 3. 스크립트 생성 (모델 미존재 시 fallback 모델 1회)
 * 4. 구조 검증 (synthetic: 기본 스크립트 대체 / live: 거부)
 * 5. 품질/정확성/출력 안전성 (참고용 메타데이터)
 * 6. 이미지 rate limit
 * 7. 이미지 생성
 * 8. 응답 조립
 */
@Slf4j
@Service
public class ComicPanelOrchestrator {

    private final RateLimitService rateLimitService;
    private final ContentSafetyService contentSafetyService;
    private final QualityValidationService qualityValidationService;
    private final ScriptGeneratorService scriptGeneratorService;
    private final ScriptParser scriptParser;
    private final ImageGeneratorService imageGeneratorService;
    private final GenerationProvider generationProvider;
    private final Clock clock;
    private final int minSceneWords;
    private final int maxSceneWords;

    public ComicPanelOrchestrator(
            RateLimitService rateLimitService,
            ContentSafetyService contentSafetyService,
            QualityValidationService qualityValidationService,
            ScriptGeneratorService scriptGeneratorService,
            ScriptParser scriptParser,
            ImageGeneratorService imageGeneratorService,
            GenerationProvider generationProvider,
            Clock clock,
            @Value("${mythos.scene.min-words:3}") int minSceneWords,
            @Value("${mythos.scene.max-words:20}") int maxSceneWords) {
        this.rateLimitService = rateLimitService;
        this.contentSafetyService = contentSafetyService;
        this.qualityValidationService = qualityValidationService;
        this.scriptGeneratorService = scriptGeneratorService;
        this.scriptParser = scriptParser;
        this.imageGeneratorService = imageGeneratorService;
        this.generationProvider = generationProvider;
        this.clock = clock;
        this.minSceneWords = minSceneWords;
        this.maxSceneWords = maxSceneWords;
    }

    // ========== 단계별 API ==========

    /**
     * 스크립트 단계만 실행 (0-5)
     */
    public PanelDto.ScriptResponse generateScript(PanelDto.ScriptRequest request, String identity) {
        String scene = request.getScene();
        SceneCategory category = orDefault(request.getSceneCategory());
        PipelineRun run = new PipelineRun("script", identity);

        ScriptPhase phase = runScriptPhase(run, scene, category, ErrorType.GENERAL_ERROR);

        PanelDto.Metadata metadata = scriptMetadata(run, scene, category, null, phase)
                .rateLimit(PanelDto.RateLimitInfo.builder()
                        .remaining(phase.getAdmission().getRemaining())
                        .resetAt(phase.getAdmission().getResetAt())
                        .build())
                .build();

        return PanelDto.ScriptResponse.builder()
                .script(phase.getScript())
                .metadata(metadata)
                .build();
    }

    /**
     * 이미지 단계만 실행 (시각 묘사 검증 → rate limit → 차단용 안전성 검사 → 생성)
     */
    public PanelDto.ImageResponse generateImage(PanelDto.ImageRequest request, String identity) {
        String description = request.getVisualDescription();
        StyleCategory style = orDefault(request.getStyleCategory());
        SceneCategory category = orDefault(request.getSceneCategory());
        PipelineRun run = new PipelineRun("image", identity);

        if (description == null || description.isBlank()) {
            throw run.reject(RejectReason.INVALID_DESCRIPTION, ErrorType.IMAGE_GENERATION_ERROR);
        }

        AdmissionDecision admission = admitImage(run, ErrorType.IMAGE_GENERATION_ERROR);

        String safetyFault = null;
        EvaluationOutcome<SafetyVerdict> screening = contentSafetyService.screen(description, SafetyContext.VISUAL_DESCRIPTION);
        if (screening.isFault()) {
            safetyFault = describeFault(screening);
            log.warn("[Pipeline] Safety evaluator fault on image description, continuing: {}", safetyFault);
        } else if (!screening.getVerdict().map(SafetyVerdict::isPassed).orElse(true)) {
            throw run.reject(RejectReason.UNSAFE_INPUT, ErrorType.IMAGE_GENERATION_ERROR,
                    unsafeMessage("Image description", screening.getVerdict().get()), null);
        }

        ImageGeneratorService.ImageResult image = synthesize(run, description, style, category);
        run.transition(PipelineState.DONE);

        PanelDto.Metadata metadata = PanelDto.Metadata.builder()
                .sceneCategory(category)
                .styleCategory(style)
                .timestamp(Instant.now(clock))
                .rateLimit(PanelDto.RateLimitInfo.builder()
                        .remaining(admission.getRemaining())
                        .resetAt(admission.getResetAt())
                        .build())
                .safetyFault(safetyFault)
                .finalState(run.getState().name())
                .providerMode(generationProvider.getMode().getCode())
                .build();

        return PanelDto.ImageResponse.builder()
                .imageRef(image.getImageRef())
                .prompt(image.getPrompt())
                .metadata(metadata)
                .build();
    }

    /**
     * 전체 파이프라인 (0-8)
     */
    public PanelDto.CompletePanelResponse completePanel(PanelDto.CompletePanelRequest request, String identity) {
        String scene = request.getScene();
        SceneCategory category = orDefault(request.getSceneCategory());
        StyleCategory style = orDefault(request.getStyleCategory());
        PipelineRun run = new PipelineRun("complete", identity);

        ScriptPhase phase = runScriptPhase(run, scene, category, ErrorType.SCRIPT_GENERATION_ERROR);

        AdmissionDecision imageAdmission = admitImage(run, ErrorType.IMAGE_GENERATION_ERROR);
        ImageGeneratorService.ImageResult image =
                synthesize(run, phase.getScript().getVisualDescription(), style, category);
        run.transition(PipelineState.DONE);

        PanelDto.Metadata metadata = scriptMetadata(run, scene, category, style, phase)
                .rateLimit(PanelDto.RateLimitInfo.builder()
                        .scriptRemaining(phase.getAdmission().getRemaining())
                        .imageRemaining(imageAdmission.getRemaining())
                        .resetAt(Math.max(phase.getAdmission().getResetAt(), imageAdmission.getResetAt()))
                        .build())
                .build();

        return PanelDto.CompletePanelResponse.builder()
                .script(phase.getScript())
                .imageRef(image.getImageRef())
                .prompt(image.getPrompt())
                .metadata(metadata)
                .build();
    }

    // ========== 스크립트 단계 ==========

    private ScriptPhase runScriptPhase(PipelineRun run, String scene, SceneCategory category, ErrorType scriptErrorType) {
        // 0. 장면 검증 (rate limit 카운트 전)
        validateScene(run, scene);

        // 1. 스크립트 rate limit
        AdmissionDecision admission = rateLimitService.checkScript(run.getIdentity());
        if (!admission.isAllowed()) {
            throw run.reject(RejectReason.RATE_LIMITED, ErrorType.GENERAL_ERROR,
                    "Script generation rate limit exceeded. Please try again later.", admission.getResetAt());
        }
        run.transition(PipelineState.ADMITTED_SCRIPT);

        // 2. 입력 안전성 (평가기 오류 시 fail-open)
        String safetyFault = null;
        EvaluationOutcome<SafetyVerdict> screening = contentSafetyService.screen(scene, SafetyContext.SCENE_INPUT);
        if (screening.isFault()) {
            safetyFault = describeFault(screening);
            log.warn("[Pipeline] Safety evaluator fault, failing open: {}", safetyFault);
        } else if (!screening.getVerdict().map(SafetyVerdict::isPassed).orElse(true)) {
            throw run.reject(RejectReason.UNSAFE_INPUT, ErrorType.GENERAL_ERROR,
                    unsafeMessage("Scene description", screening.getVerdict().get()), null);
        }
        run.transition(PipelineState.SAFE_INPUT);

        // 3. 스크립트 생성
        ScriptGeneratorService.ScriptCompletion completion;
        try {
            completion = scriptGeneratorService.generate(scene.trim(), category);
        } catch (ProviderException e) {
            log.error("[Pipeline] Script generation failed ({}): {}", e.getType(), e.getMessage());
            throw run.reject(RejectReason.GENERATION_FAILED, scriptErrorType);
        } catch (RuntimeException e) {
            log.error("[Pipeline] Unexpected script generation error", e);
            throw run.reject(RejectReason.GENERATION_FAILED, scriptErrorType);
        }
        run.transition(PipelineState.SCRIPT_GENERATED);

        // 4. 구조 검증
        boolean fallbackScriptUsed = false;
        Optional<GeneratedScript> parsed = scriptParser.parse(completion.getRawText());
        GeneratedScript script;
        if (parsed.isPresent()) {
            script = parsed.get();
        } else if (generationProvider.getMode() == ProviderMode.SYNTHETIC) {
            log.warn("[Pipeline] Synthetic script failed structural validation, using default script");
            script = GeneratedScript.from(SyntheticScript.FALLBACK);
            fallbackScriptUsed = true;
        } else {
            log.error("[Pipeline] Script from model {} failed structural validation", completion.getModel());
            throw run.reject(RejectReason.INVALID_STRUCTURE, scriptErrorType);
        }
        run.transition(PipelineState.STRUCTURALLY_VALID);

        // 5. 참고용 평가
        QualityVerdict quality = qualityValidationService.evaluate(scene, script);
        if (!quality.isValid()) {
            log.warn("[Pipeline] Script quality below threshold ({}): {}", quality.getScore(), quality.getIssues());
        }
        SafetyVerdict outputSafety = contentSafetyService.evaluate(script.combinedText(), SafetyContext.GENERATED_NARRATIVE);
        AccuracyCheck accuracy = contentSafetyService.checkMythologyAccuracy(
                script.combinedText(), CharacterProfile.recognize(scene).orElse(null));
        List<String> enhancements = contentSafetyService.enhancementSuggestions(scene);

        return ScriptPhase.builder()
                .script(script)
                .admission(admission)
                .completion(completion)
                .fallbackScriptUsed(fallbackScriptUsed)
                .quality(quality)
                .outputSafety(outputSafety)
                .accuracy(accuracy)
                .enhancements(enhancements)
                .safetyFault(safetyFault)
                .build();
    }

    private void validateScene(PipelineRun run, String scene) {
        if (scene == null || scene.isBlank()) {
            throw run.reject(RejectReason.INVALID_SCENE, ErrorType.GENERAL_ERROR,
                    "Scene description is required.", null);
        }
        int words = ContentSafetyService.countWords(scene);
        if (words < minSceneWords || words > maxSceneWords) {
            throw run.reject(RejectReason.INVALID_SCENE, ErrorType.GENERAL_ERROR,
                    "Scene description should be " + minSceneWords + "-" + maxSceneWords
                            + " words for optimal results (got " + words + ").", null);
        }
    }

    // ========== 이미지 단계 ==========

    private AdmissionDecision admitImage(PipelineRun run, ErrorType errorType) {
        AdmissionDecision admission = rateLimitService.checkImage(run.getIdentity());
        if (!admission.isAllowed()) {
            throw run.reject(RejectReason.RATE_LIMITED, errorType,
                    "Image generation rate limit exceeded. Please try again later.", admission.getResetAt());
        }
        run.transition(PipelineState.ADMITTED_IMAGE);
        return admission;
    }

    private ImageGeneratorService.ImageResult synthesize(PipelineRun run, String description,
                                                         StyleCategory style, SceneCategory category) {
        ImageGeneratorService.ImageResult image;
        try {
            image = imageGeneratorService.generate(description, style, category);
        } catch (ProviderException e) {
            log.error("[Pipeline] Image generation failed ({}): {}", e.getType(), e.getMessage());
            if (e.getType() == ProviderErrorType.CONTENT_POLICY) {
                throw run.reject(RejectReason.IMAGE_FAILED, ErrorType.IMAGE_GENERATION_ERROR,
                        "The image description was declined by the content policy. Please modify your request.", null);
            }
            throw run.reject(RejectReason.IMAGE_FAILED, ErrorType.IMAGE_GENERATION_ERROR);
        } catch (RuntimeException e) {
            log.error("[Pipeline] Unexpected image generation error", e);
            throw run.reject(RejectReason.IMAGE_FAILED, ErrorType.IMAGE_GENERATION_ERROR);
        }
        run.transition(PipelineState.IMAGE_GENERATED);
        return image;
    }

    // ========== 응답 조립 ==========

    private PanelDto.Metadata.MetadataBuilder scriptMetadata(PipelineRun run, String scene, SceneCategory category,
                                                             StyleCategory style, ScriptPhase phase) {
        return PanelDto.Metadata.builder()
                .scene(scene.trim())
                .sceneCategory(category)
                .styleCategory(style)
                .wordCount(ContentSafetyService.countWords(scene))
                .timestamp(Instant.now(clock))
                .model(phase.getCompletion().getModel())
                .fallbackModelUsed(phase.getCompletion().isFallbackModelUsed())
                .fallbackScriptUsed(phase.isFallbackScriptUsed())
                .quality(phase.getQuality())
                .outputSafety(phase.getOutputSafety())
                .accuracy(phase.getAccuracy())
                .enhancementSuggestions(phase.getEnhancements())
                .safetyFault(phase.getSafetyFault())
                .finalState(run.getState().name())
                .providerMode(generationProvider.getMode().getCode());
    }

    private static String unsafeMessage(String subject, SafetyVerdict verdict) {
        String message = subject + " contains inappropriate content. Please modify your request.";
        if (verdict.getSuggestions().isEmpty()) {
            return message;
        }
        return message + " Suggestions: " + String.join("; ", verdict.getSuggestions());
    }

    private static String describeFault(EvaluationOutcome<?> outcome) {
        return outcome.getFault()
                .map(fault -> fault.getEvaluator() + ": " + fault.getDetail())
                .orElse("unknown");
    }

    private static SceneCategory orDefault(SceneCategory category) {
        return category != null ? category : SceneCategory.GENERAL;
    }

    private static StyleCategory orDefault(StyleCategory style) {
        return style != null ? style : StyleCategory.VIBRANT;
    }

    /**
     * 스크립트 단계 결과
     */
    @Getter
    @Builder
    private static class ScriptPhase {
        private final GeneratedScript script;
        private final AdmissionDecision admission;
        private final ScriptGeneratorService.ScriptCompletion completion;
        private final boolean fallbackScriptUsed;
        private final QualityVerdict quality;
        private final SafetyVerdict outputSafety;
        private final AccuracyCheck accuracy;
        private final List<String> enhancements;
        private final String safetyFault;
    }

    /**
     * 요청 1건의 상태 추적
     */
    private static class PipelineRun {

        private final String flow;
        @Getter
        private final String identity;
        @Getter
        private PipelineState state = PipelineState.IDLE;

        PipelineRun(String flow, String identity) {
            this.flow = flow;
            this.identity = identity;
        }

        void transition(PipelineState next) {
            log.debug("[Pipeline] {} {}: {} -> {}", flow, identity, state, next);
            state = next;
        }

        GenerationRejectedException reject(RejectReason reason, ErrorType errorType) {
            return reject(reason, errorType, reason.getErrorCode().getMessage(), null);
        }

        GenerationRejectedException reject(RejectReason reason, ErrorType errorType, String message, Long resetAt) {
            log.info("[Pipeline] {} {} rejected at {}: {}", flow, identity, state, reason.getCode());
            return new GenerationRejectedException(reason, state, errorType, message, resetAt);
        }
    }
}
