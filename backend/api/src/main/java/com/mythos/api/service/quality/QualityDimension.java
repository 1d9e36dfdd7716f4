package com.mythos.api.service.quality;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 품질 평가 차원과 가중치 (합계 1.0)
 */
@Getter
@RequiredArgsConstructor
public enum QualityDimension {

    MYTHOLOGICAL_ACCURACY("Mythological Accuracy", 0.30),
    VISUAL_COHERENCE("Visual Coherence", 0.25),
    CULTURAL_AUTHENTICITY("Cultural Authenticity", 0.25),
    STORYTELLING_QUALITY("Storytelling Quality", 0.20);

    private final String displayName;
    private final double weight;
}
