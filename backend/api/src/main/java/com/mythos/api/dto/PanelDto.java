package com.mythos.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.mythos.api.service.quality.QualityVerdict;
import com.mythos.api.service.safety.AccuracyCheck;
import com.mythos.api.service.safety.SafetyVerdict;
import com.mythos.api.service.script.GeneratedScript;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * 만화 패널 생성 API DTO
 */
public class PanelDto {

    /**
     * 스크립트 생성 요청
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScriptRequest {
        private String scene;
        @JsonAlias("sceneType")
        private SceneCategory sceneCategory;   // 생략 시 general
    }

    /**
     * 이미지 생성 요청
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageRequest {
        @JsonAlias("imageDescription")
        private String visualDescription;
        @JsonAlias("styleType")
        private StyleCategory styleCategory;   // 생략 시 vibrant
        @JsonAlias("sceneType")
        private SceneCategory sceneCategory;
    }

    /**
     * 스크립트 + 이미지 통합 생성 요청
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompletePanelRequest {
        private String scene;
        @JsonAlias("sceneType")
        private SceneCategory sceneCategory;
        @JsonAlias("styleType")
        private StyleCategory styleCategory;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScriptResponse {
        private GeneratedScript script;
        private Metadata metadata;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageResponse {
        private String imageRef;
        private String prompt;
        private Metadata metadata;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompletePanelResponse {
        private GeneratedScript script;
        private String imageRef;
        private String prompt;
        private Metadata metadata;
    }

    /**
     * 생성 메타데이터 (단계별로 채워지는 필드가 다름)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Metadata {
        private String scene;
        private SceneCategory sceneCategory;
        private StyleCategory styleCategory;
        private Integer wordCount;
        private Instant timestamp;
        private RateLimitInfo rateLimit;

        private String model;
        private Boolean fallbackModelUsed;
        private Boolean fallbackScriptUsed;

        private QualityVerdict quality;
        private SafetyVerdict outputSafety;
        private AccuracyCheck accuracy;
        private List<String> enhancementSuggestions;

        private String safetyFault;     // 안전성 평가기 실패로 fail-open 된 경우
        private String finalState;
        private String providerMode;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RateLimitInfo {
        private Integer remaining;
        private Integer scriptRemaining;
        private Integer imageRemaining;
        private Long resetAt;
    }

    /**
     * Rate limit 리셋 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResetResponse {
        private String message;
        private Instant timestamp;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HealthResponse {
        private String status;
        private String providerMode;
        private String profile;
        private Instant timestamp;
    }
}
