package com.mythos.api.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 결정적 synthetic 어댑터 (API 키 미설정 시)
 *
 * 키워드 매칭 순서대로 고정 스크립트/이미지를 선택하며 절대 실패하지 않음.
 * 키워드는 단어 시작 기준으로 매칭 ("lift" → "lifts", "ram" ↛ "dramatic")
 */
@Slf4j
public class SyntheticProvider implements GenerationProvider {

    static final String IMAGE_JEWEL = "https://images.unsplash.com/photo-1578662996442-48f60103fc96?w=800&h=600&fit=crop&crop=center&q=80";
    static final String IMAGE_CELESTIAL = "https://images.unsplash.com/photo-1506905925346-21bda4d32df4?w=800&h=600&fit=crop&crop=center&q=80";
    static final String IMAGE_EARTH = "https://images.unsplash.com/photo-1541961017774-22349e4a1262?w=800&h=600&fit=crop&crop=center&q=80";

    private final ObjectMapper objectMapper;

    public SyntheticProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderMode getMode() {
        return ProviderMode.SYNTHETIC;
    }

    @Override
    public String completeText(ScriptPrompt prompt, String model) {
        SyntheticScript script = selectScript(prompt.getScene(), prompt.getSceneCategory());
        log.info("[Provider] Synthetic script selected: {}", script);

        return objectMapper.createObjectNode()
                .put("narrator_caption", script.getNarration())
                .put("dialogue", script.getDialogue())
                .put("image_description", script.getVisualDescription())
                .toString();
    }

    @Override
    public String synthesizeImage(ImagePrompt prompt, StyleCategory style) {
        String imageRef = selectImage(prompt.getVisualDescription(), style);
        log.info("[Provider] Synthetic image selected for style {}", style.getCode());
        return imageRef;
    }

    @Override
    public ModerationResult moderate(String text) {
        return ModerationResult.passed();
    }

    static SyntheticScript selectScript(String scene, SceneCategory category) {
        String text = lower(scene);

        if (mentions(text, "krishna", "flute", "govardhan")) {
            return mentions(text, "govardhan", "lift") ? SyntheticScript.KRISHNA_GOVARDHAN : SyntheticScript.KRISHNA_FLUTE;
        }
        if (mentions(text, "ram", "bow", "arrow", "sita")) {
            return mentions(text, "bow", "break") ? SyntheticScript.RAMA_BOW : SyntheticScript.RAMA_ARROW;
        }
        if (mentions(text, "hanuman", "leap", "mountain")) {
            return SyntheticScript.HANUMAN_LEAP;
        }
        if (mentions(text, "shiva", "third eye", "cosmic")) {
            return SyntheticScript.SHIVA_THIRD_EYE;
        }
        if (mentions(text, "durga", "battle", "demon")) {
            return SyntheticScript.DURGA_MAHISHASURA;
        }
        if (mentions(text, "ganesha", "writing", "mahabharata")) {
            return SyntheticScript.GANESHA_SCRIBE;
        }
        if (mentions(text, "meditation", "spiritual", "enlighten")) {
            return SyntheticScript.MEDITATION;
        }
        if (mentions(text, "battle", "fight", "war")) {
            return SyntheticScript.WARRIOR;
        }

        if (category == SceneCategory.ACTION) {
            return SyntheticScript.WARRIOR;
        }
        if (category == SceneCategory.SPIRITUAL) {
            return SyntheticScript.MEDITATION;
        }
        return SyntheticScript.GENERAL;
    }

    static String selectImage(String description, StyleCategory style) {
        String text = lower(description);

        if (mentions(text, "krishna", "flute", "govardhan")) return IMAGE_JEWEL;
        if (mentions(text, "ram", "bow", "arrow", "sita")) return IMAGE_CELESTIAL;
        if (mentions(text, "hanuman", "monkey", "leap", "mountain")) return IMAGE_EARTH;
        if (mentions(text, "shiva", "meditation", "third eye", "cosmic")) return IMAGE_CELESTIAL;
        if (mentions(text, "durga", "battle", "demon", "weapon")) return IMAGE_JEWEL;
        if (mentions(text, "ganesha", "wisdom", "writing", "elephant")) return IMAGE_EARTH;
        if (mentions(text, "temple", "spiritual", "divine", "sacred")) return IMAGE_CELESTIAL;
        if (mentions(text, "battle", "fight", "war", "attack")) return IMAGE_JEWEL;

        if (style == StyleCategory.EARTH) return IMAGE_EARTH;
        if (style == StyleCategory.DIVINE) return IMAGE_CELESTIAL;
        return IMAGE_JEWEL;
    }

    private static boolean mentions(String text, String... keywords) {
        for (String keyword : keywords) {
            if (Pattern.compile("\\b" + Pattern.quote(keyword)).matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
