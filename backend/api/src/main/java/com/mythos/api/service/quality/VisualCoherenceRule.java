package com.mythos.api.service.quality;

import com.mythos.api.service.script.GeneratedScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 시각적 일관성 (가중치 0.25)
 */
@Component
public class VisualCoherenceRule implements QualityRule {

    static final int MIN_DESCRIPTION_CHARS = 30;
    static final int MAX_DESCRIPTION_CHARS = 100;
    static final int MAX_MISSING_ELEMENTS = 3;

    static final List<String> VISUAL_ELEMENTS = List.of(
            "character", "pose", "expression", "setting", "lighting",
            "clothing", "weapons", "background", "atmosphere"
    );

    // 한 장면에 함께 나오면 모순인 단어 쌍
    static final List<String[]> CONTRADICTIONS = List.of(
            new String[]{"day", "stars"},
            new String[]{"indoor", "mountain"},
            new String[]{"underwater", "fire"}
    );

    @Override
    public QualityDimension getDimension() {
        return QualityDimension.VISUAL_COHERENCE;
    }

    @Override
    public RuleResult apply(String scene, GeneratedScript script) {
        RuleResult result = new RuleResult(getDimension());
        String description = script.getVisualDescription() == null ? "" : script.getVisualDescription();
        String lower = TextMatch.lower(description);

        if (description.length() < MIN_DESCRIPTION_CHARS) {
            result.deduct(15, "Image description too short", "Provide more detailed visual description");
        }
        if (description.length() > MAX_DESCRIPTION_CHARS) {
            result.deduct(10, "Image description too long", "Keep description concise but detailed");
        }

        List<String> missing = VISUAL_ELEMENTS.stream()
                .filter(element -> !lower.contains(element))
                .toList();
        if (missing.size() > MAX_MISSING_ELEMENTS) {
            result.deduct(20,
                    "Missing key visual elements: " + String.join(", ", missing.subList(0, MAX_MISSING_ELEMENTS)),
                    "Include character appearance, setting, and atmosphere details");
        }

        if (hasContradiction(lower)) {
            result.deduct(15,
                    "Visual elements have logical inconsistencies",
                    "Ensure all visual elements work together logically");
        }
        return result;
    }

    static boolean hasContradiction(String lowerDescription) {
        return CONTRADICTIONS.stream().anyMatch(pair ->
                TextMatch.containsWord(lowerDescription, pair[0]) && TextMatch.containsWord(lowerDescription, pair[1]));
    }
}
