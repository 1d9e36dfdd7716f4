package com.mythos.api.service.image;

import com.mythos.api.service.provider.ImagePrompt;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import com.mythos.common.prompt.CharacterProfile;
import com.mythos.common.prompt.ColorPalette;
import com.mythos.common.prompt.SceneEnhancement;
import com.mythos.common.prompt.StyleKeywords;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 이미지 프롬프트 조립
 *
 * 순서: 시각 묘사 → 캐릭터 스타일링 → 문화적 맥락 → 핵심 화풍 → 시각 특징 → 색상 팔레트 → 장면 강조 → 기술 품질
 * 최대 길이를 넘으면 시각 묘사 부분을 잘라 맞춤
 */
@Component
public class ImagePromptBuilder {

    private static final int MAX_CULTURAL_ELEMENTS = 2;

    private final int maxPromptLength;

    public ImagePromptBuilder(@Value("${mythos.image.max-prompt-length:1000}") int maxPromptLength) {
        this.maxPromptLength = maxPromptLength;
    }

    public ImagePrompt build(String visualDescription, StyleCategory style, SceneCategory category) {
        String description = visualDescription.trim();

        List<String> suffixParts = new ArrayList<>();
        CharacterProfile.recognize(description).ifPresent(character -> suffixParts.add(character.getImageStyle()));

        List<String> cultural = StyleKeywords.culturalElements(description);
        suffixParts.addAll(cultural.subList(0, Math.min(MAX_CULTURAL_ELEMENTS, cultural.size())));

        suffixParts.add(StyleKeywords.CORE);
        suffixParts.add(StyleKeywords.VISUAL);
        suffixParts.add(ColorPalette.forStyle(style).getPromptText());
        suffixParts.add(SceneEnhancement.forCategory(category).getPromptText());
        suffixParts.add(StyleKeywords.TECHNICAL);

        String suffix = ", " + StyleKeywords.combine(suffixParts.toArray(new String[0]));

        return ImagePrompt.builder()
                .visualDescription(description)
                .styleCategory(style)
                .sceneCategory(category)
                .prompt(fit(description, suffix))
                .build();
    }

    private String fit(String description, String suffix) {
        if (description.length() + suffix.length() <= maxPromptLength) {
            return description + suffix;
        }
        int room = maxPromptLength - suffix.length();
        if (room <= 0) {
            // 스타일 조각만으로 한도 초과: 전체를 잘라냄
            return (description + suffix).substring(0, maxPromptLength);
        }
        return description.substring(0, room).trim() + suffix;
    }

    public int getMaxPromptLength() {
        return maxPromptLength;
    }
}
