package com.mythos.api.service.quality;

import com.mythos.api.service.safety.AccuracyCheck;
import com.mythos.api.service.safety.ContentSafetyService;
import com.mythos.api.service.script.GeneratedScript;
import com.mythos.common.prompt.CharacterProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 신화적 정확성 (가중치 0.30)
 * - 장면에 등장한 캐릭터가 스크립트에서 부정적으로 묘사되면 캐릭터당 -15
 * - 캡션+묘사에 핵심 신화 요소가 없으면 -20
 * - 문화적 맥락 문제(카스트 언급 등) -10
 */
@Component
@RequiredArgsConstructor
public class MythologicalAccuracyRule implements QualityRule {

    static final List<String> CORE_ELEMENTS = List.of(
            "divine", "sacred", "cosmic", "spiritual", "temple", "ashram",
            "guru", "yoga", "meditation", "dharma", "karma", "moksha"
    );

    // 캐릭터별 부적절 묘사
    static final Map<CharacterProfile, List<String>> NEGATIVE_PORTRAYALS = Map.of(
            CharacterProfile.KRISHNA, List.of("evil", "destructive"),
            CharacterProfile.HANUMAN, List.of("disloyal", "corrupt"),
            CharacterProfile.SHIVA, List.of("evil", "corrupt")
    );

    private final ContentSafetyService contentSafetyService;

    @Override
    public QualityDimension getDimension() {
        return QualityDimension.MYTHOLOGICAL_ACCURACY;
    }

    @Override
    public RuleResult apply(String scene, GeneratedScript script) {
        RuleResult result = new RuleResult(getDimension());
        String description = TextMatch.lower(script.getVisualDescription());

        for (CharacterProfile character : CharacterProfile.values()) {
            if (!character.mentionedIn(scene)) {
                continue;
            }
            List<String> negatives = NEGATIVE_PORTRAYALS.getOrDefault(character, List.of());
            boolean misportrayed = negatives.stream().anyMatch(word -> TextMatch.containsWord(description, word));
            if (misportrayed) {
                result.deduct(15,
                        character.getDisplayName() + " should not be portrayed as " + String.join("/", negatives),
                        "Focus on " + character.getDisplayName() + "'s divine and protective nature");
            }
        }

        String combined = TextMatch.lower(script.combinedText());
        if (!TextMatch.containsAny(combined, CORE_ELEMENTS)) {
            result.deduct(20,
                    "Missing core mythological elements",
                    "Include references to divine powers, sacred places, or spiritual concepts");
        }

        AccuracyCheck cultural = contentSafetyService.checkMythologyAccuracy(script.combinedText(), null);
        if (!cultural.getIssues().isEmpty()) {
            result.deduct(10, cultural.getIssues().get(0),
                    "Focus on universal spiritual values and divine qualities");
        }
        return result;
    }
}
