package com.mythos.api.service.quality;

import com.mythos.api.service.script.GeneratedScript;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 생성 스크립트 품질 평가
 * 네 규칙의 가중 합을 반올림한 값이 종합 점수 (70 이상 valid)
 */
@Slf4j
@Service
public class QualityValidationService {

    private static final int STRENGTH_THRESHOLD = 80;
    private static final int EXCELLENT_THRESHOLD = 90;

    private final List<QualityRule> rules;

    public QualityValidationService(List<QualityRule> rules) {
        List<QualityRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparing(rule -> rule.getDimension().ordinal()));
        this.rules = List.copyOf(ordered);
    }

    /**
     * 규칙 평가
     * 개별 규칙 오류는 해당 차원만 중립 점수로, 집계 자체의 오류는 중립 판정으로 대체
     */
    public QualityVerdict evaluate(String scene, GeneratedScript script) {
        try {
            return aggregate(scene, script);
        } catch (RuntimeException e) {
            log.warn("[Quality] Evaluator fault, returning neutral verdict: {}", e.getMessage());
            return QualityVerdict.neutral();
        }
    }

    private QualityVerdict aggregate(String scene, GeneratedScript script) {
        Map<QualityDimension, Integer> scores = new EnumMap<>(QualityDimension.class);
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        List<String> strengths = new ArrayList<>();
        double weighted = 0;

        for (QualityRule rule : rules) {
            QualityDimension dimension = rule.getDimension();
            RuleResult result = applyRule(rule, scene, script);

            scores.put(dimension, result.getScore());
            weighted += result.getScore() * dimension.getWeight();
            issues.addAll(result.getIssues());
            suggestions.addAll(result.getSuggestions());

            if (result.getScore() >= STRENGTH_THRESHOLD) {
                strengths.add(dimension.getDisplayName() + ": "
                        + (result.getScore() >= EXCELLENT_THRESHOLD ? "excellent" : "good"));
            }
        }

        int score = (int) Math.round(weighted);
        log.debug("[Quality] Aggregate score: {} ({})", score, scores);

        return QualityVerdict.builder()
                .valid(score >= QualityVerdict.VALID_THRESHOLD)
                .score(score)
                .issues(issues)
                .suggestions(suggestions)
                .strengths(strengths)
                .mythologicalAccuracy(scores.getOrDefault(QualityDimension.MYTHOLOGICAL_ACCURACY, 0))
                .visualCoherence(scores.getOrDefault(QualityDimension.VISUAL_COHERENCE, 0))
                .culturalAuthenticity(scores.getOrDefault(QualityDimension.CULTURAL_AUTHENTICITY, 0))
                .storytellingQuality(scores.getOrDefault(QualityDimension.STORYTELLING_QUALITY, 0))
                .build();
    }

    private RuleResult applyRule(QualityRule rule, String scene, GeneratedScript script) {
        try {
            return rule.apply(scene, script);
        } catch (RuntimeException e) {
            log.warn("[Quality] Rule {} failed, using neutral score: {}", rule.getDimension(), e.getMessage());
            return RuleResult.neutral(rule.getDimension());
        }
    }
}
