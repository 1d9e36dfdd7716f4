package com.mythos.api.service.quality;

import com.mythos.api.service.script.GeneratedScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 스토리텔링 품질 (가중치 0.20)
 */
@Component
public class StorytellingQualityRule implements QualityRule {

    static final int MIN_CAPTION_CHARS = 15;
    static final int MAX_CAPTION_CHARS = 35;
    static final int MAX_DIALOGUE_CHARS = 20;
    static final int MIN_NARRATIVE_WORDS = 10;

    static final List<String> EMOTIONAL_WORDS = List.of(
            "divine", "sacred", "majestic", "powerful", "beautiful", "awe-inspiring"
    );

    @Override
    public QualityDimension getDimension() {
        return QualityDimension.STORYTELLING_QUALITY;
    }

    @Override
    public RuleResult apply(String scene, GeneratedScript script) {
        RuleResult result = new RuleResult(getDimension());
        String caption = script.getNarration() == null ? "" : script.getNarration();
        String dialogue = script.getDialogue() == null ? "" : script.getDialogue();

        if (caption.length() < MIN_CAPTION_CHARS) {
            result.deduct(15, "Narrator caption too short", "Provide more descriptive narration");
        }
        if (caption.length() > MAX_CAPTION_CHARS) {
            result.deduct(10, "Narrator caption too long", "Keep narration concise but impactful");
        }
        if (dialogue.length() > MAX_DIALOGUE_CHARS) {
            result.deduct(10, "Dialogue too long", "Keep dialogue short and impactful");
        }

        String emotionalText = TextMatch.lower(caption + " " + dialogue);
        if (!TextMatch.containsAny(emotionalText, EMOTIONAL_WORDS)) {
            result.deduct(15, "Lacks emotional impact", "Include words that convey mythological grandeur");
        }

        if (!hasNarrativeStructure(caption)) {
            result.deduct(10, "Poor narrative structure", "Create a clear beginning, middle, and end in the narration");
        }
        return result;
    }

    static boolean hasNarrativeStructure(String caption) {
        String trimmed = caption.trim();
        return trimmed.split("\\s+").length >= MIN_NARRATIVE_WORDS
                && trimmed.contains(",")
                && trimmed.endsWith(".");
    }
}
