package com.mythos.api.service.quality;

import com.mythos.api.service.script.GeneratedScript;

/**
 * 품질 규칙 (장면 텍스트 + 생성된 스크립트만으로 결정되는 순수 함수)
 */
public interface QualityRule {

    QualityDimension getDimension();

    RuleResult apply(String scene, GeneratedScript script);
}
