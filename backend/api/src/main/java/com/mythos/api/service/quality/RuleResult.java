package com.mythos.api.service.quality;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 단일 품질 규칙 결과 (100점에서 감점, 0점 하한)
 */
@Getter
public class RuleResult {

    public static final int PASS_THRESHOLD = 70;

    private final QualityDimension dimension;
    private int score = 100;
    private final List<String> issues = new ArrayList<>();
    private final List<String> suggestions = new ArrayList<>();

    public RuleResult(QualityDimension dimension) {
        this.dimension = dimension;
    }

    /**
     * 규칙 실행 실패 시 대체 결과 (통과 기준 점수)
     */
    public static RuleResult neutral(QualityDimension dimension) {
        RuleResult result = new RuleResult(dimension);
        result.score = PASS_THRESHOLD;
        return result;
    }

    public RuleResult deduct(int points, String issue, String suggestion) {
        score = Math.max(0, score - points);
        issues.add(issue);
        suggestions.add(suggestion);
        return this;
    }

    public boolean isPassed() {
        return score >= PASS_THRESHOLD;
    }
}
