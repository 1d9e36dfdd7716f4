package com.mythos.api.service.quality;

import com.mythos.api.service.provider.SyntheticScript;
import com.mythos.api.service.script.GeneratedScript;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("QualityValidationService")
class QualityValidationServiceTest {

    private static final GeneratedScript SCRIPT = GeneratedScript.from(SyntheticScript.KRISHNA_GOVARDHAN);

    @Test
    @DisplayName("종합 점수는 차원 점수의 가중 합을 반올림한 값")
    void aggregateIsRoundedWeightedSum() {
        QualityValidationService service = new QualityValidationService(List.of(
                fixed(QualityDimension.STORYTELLING_QUALITY, 55),
                fixed(QualityDimension.MYTHOLOGICAL_ACCURACY, 85),
                fixed(QualityDimension.VISUAL_COHERENCE, 65),
                fixed(QualityDimension.CULTURAL_AUTHENTICITY, 85)
        ));

        QualityVerdict verdict = service.evaluate("Krishna lifts the hill", SCRIPT);

        // 85*0.30 + 65*0.25 + 85*0.25 + 55*0.20 = 74.0
        assertThat(verdict.getScore()).isEqualTo(74);
        assertThat(verdict.isValid()).isTrue();
        assertThat(verdict.getMythologicalAccuracy()).isEqualTo(85);
        assertThat(verdict.getVisualCoherence()).isEqualTo(65);
        assertThat(verdict.getCulturalAuthenticity()).isEqualTo(85);
        assertThat(verdict.getStorytellingQuality()).isEqualTo(55);
        assertThat(verdict.isNeutral()).isFalse();
    }

    @Test
    @DisplayName("80점 이상 차원은 강점, 90점 이상은 excellent")
    void recordsStrengths() {
        QualityValidationService service = new QualityValidationService(List.of(
                fixed(QualityDimension.MYTHOLOGICAL_ACCURACY, 95),
                fixed(QualityDimension.VISUAL_COHERENCE, 80),
                fixed(QualityDimension.CULTURAL_AUTHENTICITY, 70),
                fixed(QualityDimension.STORYTELLING_QUALITY, 40)
        ));

        QualityVerdict verdict = service.evaluate("scene", SCRIPT);

        assertThat(verdict.getStrengths())
                .containsExactly("Mythological Accuracy: excellent", "Visual Coherence: good");
    }

    @Test
    @DisplayName("70점 미만이면 invalid")
    void belowThresholdIsInvalid() {
        QualityValidationService service = new QualityValidationService(List.of(
                fixed(QualityDimension.MYTHOLOGICAL_ACCURACY, 60),
                fixed(QualityDimension.VISUAL_COHERENCE, 60),
                fixed(QualityDimension.CULTURAL_AUTHENTICITY, 60),
                fixed(QualityDimension.STORYTELLING_QUALITY, 60)
        ));

        QualityVerdict verdict = service.evaluate("scene", SCRIPT);

        assertThat(verdict.getScore()).isEqualTo(60);
        assertThat(verdict.isValid()).isFalse();
    }

    @Test
    @DisplayName("규칙 하나가 실패하면 그 차원만 중립 점수 70")
    void failingRuleScoresNeutralForItsDimension() {
        QualityValidationService service = new QualityValidationService(List.of(
                fixed(QualityDimension.MYTHOLOGICAL_ACCURACY, 90),
                broken(QualityDimension.VISUAL_COHERENCE),
                fixed(QualityDimension.CULTURAL_AUTHENTICITY, 90),
                fixed(QualityDimension.STORYTELLING_QUALITY, 90)
        ));

        QualityVerdict verdict = service.evaluate("scene", SCRIPT);

        // 90*0.30 + 70*0.25 + 90*0.25 + 90*0.20 = 85.0
        assertThat(verdict.getVisualCoherence()).isEqualTo(RuleResult.PASS_THRESHOLD);
        assertThat(verdict.getScore()).isEqualTo(85);
        assertThat(verdict.isValid()).isTrue();
        assertThat(verdict.isNeutral()).isFalse();
    }

    @Test
    @DisplayName("모든 규칙이 실패해도 통과 기준 점수")
    void allRulesFailingStillPass() {
        QualityValidationService service = new QualityValidationService(List.of(
                broken(QualityDimension.MYTHOLOGICAL_ACCURACY),
                broken(QualityDimension.VISUAL_COHERENCE),
                broken(QualityDimension.CULTURAL_AUTHENTICITY),
                broken(QualityDimension.STORYTELLING_QUALITY)
        ));

        QualityVerdict verdict = service.evaluate("scene", SCRIPT);

        assertThat(verdict.getScore()).isEqualTo(QualityVerdict.VALID_THRESHOLD);
        assertThat(verdict.isValid()).isTrue();
        assertThat(verdict.getIssues()).isEmpty();
    }

    @Test
    @DisplayName("시각 규칙: 모순된 요소는 감점, 단어 일부는 모순 아님")
    void visualRulePenalizesContradictions() {
        VisualCoherenceRule visual = new VisualCoherenceRule();
        GeneratedScript script = GeneratedScript.builder()
                .narration("Krishna stands on the hill.")
                .dialogue("")
                .visualDescription("An evil Krishna on an indoor mountain at day under stars")
                .build();

        assertThat(VisualCoherenceRule.hasContradiction(script.getVisualDescription().toLowerCase())).isTrue();
        assertThat(visual.apply("Krishna on the hill", script).getScore()).isLessThan(100);

        assertThat(VisualCoherenceRule.hasContradiction("a holiday under the stars")).isFalse();
    }

    @Test
    @DisplayName("내레이션 구조 판정")
    void narrativeStructure() {
        assertThat(StorytellingQualityRule.hasNarrativeStructure(
                "With divine strength, Lord Krishna lifts the mighty Govardhan Hill to protect his devotees.")).isTrue();
        assertThat(StorytellingQualityRule.hasNarrativeStructure("Krishna lifts the hill.")).isFalse();
    }

    private static QualityRule fixed(QualityDimension dimension, int score) {
        return new QualityRule() {
            @Override
            public QualityDimension getDimension() {
                return dimension;
            }

            @Override
            public RuleResult apply(String scene, GeneratedScript script) {
                RuleResult result = new RuleResult(dimension);
                if (score < 100) {
                    result.deduct(100 - score, dimension.getDisplayName() + " issue", "improve");
                }
                return result;
            }
        };
    }

    private static QualityRule broken(QualityDimension dimension) {
        return new QualityRule() {
            @Override
            public QualityDimension getDimension() {
                return dimension;
            }

            @Override
            public RuleResult apply(String scene, GeneratedScript script) {
                throw new IllegalStateException("rule failed");
            }
        };
    }
}
