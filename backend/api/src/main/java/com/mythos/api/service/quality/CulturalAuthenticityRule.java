package com.mythos.api.service.quality;

import com.mythos.api.service.script.GeneratedScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 문화적 진정성 (가중치 0.25)
 */
@Component
public class CulturalAuthenticityRule implements QualityRule {

    static final List<String> DISRESPECTFUL_TERMS = List.of("idol", "pagan", "primitive", "superstitious");
    static final List<String> STEREOTYPES = List.of("mystical east", "exotic", "oriental", "primitive");
    static final List<String> AUTHENTIC_ELEMENTS = List.of(
            "temple", "ashram", "guru", "yoga", "meditation", "bhakti", "dharma", "karma", "moksha"
    );

    @Override
    public QualityDimension getDimension() {
        return QualityDimension.CULTURAL_AUTHENTICITY;
    }

    @Override
    public RuleResult apply(String scene, GeneratedScript script) {
        RuleResult result = new RuleResult(getDimension());
        String combined = TextMatch.lower(script.combinedText());

        if (TextMatch.containsAny(combined, DISRESPECTFUL_TERMS)) {
            result.deduct(25, "Contains disrespectful language", "Use respectful and culturally appropriate terminology");
        }
        if (TextMatch.containsAny(combined, STEREOTYPES)) {
            result.deduct(20, "Contains cultural stereotypes", "Avoid oversimplified cultural representations");
        }
        if (!TextMatch.containsAny(combined, AUTHENTIC_ELEMENTS)) {
            result.deduct(15, "Missing authentic cultural elements", "Include specific cultural details and traditions");
        }
        return result;
    }
}
