package com.mythos.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 앱 시작 시 mythos.* 설정 검증
 * 잘못된 값이 있으면 기동 실패, API 키 누락은 경고만 (synthetic 모드로 동작)
 */
@Slf4j
@Component
public class MythosConfigValidator implements ApplicationRunner {

    private final String deploymentProfile;
    private final long windowMs;
    private final int scriptCeiling;
    private final int imageCeiling;
    private final int minSceneWords;
    private final int maxSceneWords;
    private final int maxGalleryPanels;
    private final String providerMode;
    private final String apiKey;

    public MythosConfigValidator(
            @Value("${mythos.deployment-profile:development}") String deploymentProfile,
            @Value("${mythos.rate-limit.window-ms:60000}") long windowMs,
            @Value("${mythos.rate-limit.script.requests-per-window:0}") int scriptCeiling,
            @Value("${mythos.rate-limit.image.requests-per-window:0}") int imageCeiling,
            @Value("${mythos.scene.min-words:3}") int minSceneWords,
            @Value("${mythos.scene.max-words:20}") int maxSceneWords,
            @Value("${mythos.gallery.max-panels:50}") int maxGalleryPanels,
            @Value("${mythos.provider.mode:auto}") String providerMode,
            @Value("${mythos.provider.api-key:}") String apiKey) {
        this.deploymentProfile = deploymentProfile;
        this.windowMs = windowMs;
        this.scriptCeiling = scriptCeiling;
        this.imageCeiling = imageCeiling;
        this.minSceneWords = minSceneWords;
        this.maxSceneWords = maxSceneWords;
        this.maxGalleryPanels = maxGalleryPanels;
        this.providerMode = providerMode;
        this.apiKey = apiKey;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("[Config] {}", problem));
            throw new IllegalStateException("Invalid mythos configuration: " + String.join("; ", problems));
        }

        if (!"synthetic".equalsIgnoreCase(providerMode) && !ProviderConfig.hasUsableApiKey(apiKey)) {
            log.warn("[Config] mythos.provider.api-key is not set. Responses come from the synthetic provider.");
        }
        log.info("[Config] Validated (profile: {}, window: {}ms, scene words: {}-{})",
                DeploymentProfile.fromCode(deploymentProfile).getCode(), windowMs, minSceneWords, maxSceneWords);
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (windowMs <= 0) {
            problems.add("mythos.rate-limit.window-ms must be positive");
        }
        // 0은 프로파일 기본값 사용
        if (scriptCeiling < 0) {
            problems.add("mythos.rate-limit.script.requests-per-window must not be negative");
        }
        if (imageCeiling < 0) {
            problems.add("mythos.rate-limit.image.requests-per-window must not be negative");
        }
        if (minSceneWords < 1) {
            problems.add("mythos.scene.min-words must be at least 1");
        }
        if (minSceneWords > maxSceneWords) {
            problems.add("mythos.scene.min-words must not exceed mythos.scene.max-words");
        }
        if (maxGalleryPanels <= 0) {
            problems.add("mythos.gallery.max-panels must be positive");
        }
        return problems;
    }
}
