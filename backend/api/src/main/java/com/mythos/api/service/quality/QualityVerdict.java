package com.mythos.api.service.quality;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 품질 판정 (참고용, 파이프라인을 막지 않음)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityVerdict {

    public static final int VALID_THRESHOLD = 70;

    private boolean valid;
    private int score;
    @Builder.Default
    private List<String> issues = new ArrayList<>();
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
    @Builder.Default
    private List<String> strengths = new ArrayList<>();

    private int mythologicalAccuracy;
    private int visualCoherence;
    private int culturalAuthenticity;
    private int storytellingQuality;

    // 평가기 오류로 판정을 건너뛴 경우 true
    private boolean neutral;

    /**
     * 평가기 오류 시 중립 통과 판정
     */
    public static QualityVerdict neutral() {
        return QualityVerdict.builder()
                .valid(true)
                .score(VALID_THRESHOLD)
                .mythologicalAccuracy(VALID_THRESHOLD)
                .visualCoherence(VALID_THRESHOLD)
                .culturalAuthenticity(VALID_THRESHOLD)
                .storytellingQuality(VALID_THRESHOLD)
                .neutral(true)
                .build();
    }
}
