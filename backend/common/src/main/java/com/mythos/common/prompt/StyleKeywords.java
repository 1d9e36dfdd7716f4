package com.mythos.common.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 이미지 스타일 키워드 상수
 */
public final class StyleKeywords {

    private StyleKeywords() {}

    /**
     * 핵심 화풍 (Amar Chitra Katha 스타일)
     */
    public static final String CORE =
            "classic Indian comic book art, Amar Chitra Katha inspired, vintage mythological illustration";

    /**
     * 시각적 특징
     */
    public static final String VISUAL =
            "bold black outlines, flat color areas, dramatic composition, heroic proportions, " +
            "decorative borders, traditional Indian art elements";

    /**
     * 기술적 품질
     */
    public static final String TECHNICAL =
            "high detail, sharp focus, professional illustration, clean vector-style art, print-ready quality";

    /**
     * 카테고리 조합 유틸리티
     */
    public static String combine(String... fragments) {
        return String.join(", ", fragments);
    }

    /**
     * 장면 설명에 등장하는 장소에 맞춘 문화적 맥락 조각
     */
    public static List<String> culturalElements(String description) {
        List<String> elements = new ArrayList<>();
        if (description == null) {
            return elements;
        }
        String lower = description.toLowerCase(Locale.ROOT);

        if (lower.contains("temple")) {
            elements.add("ancient temple architecture");
            elements.add("sacred geometry");
        }
        if (lower.contains("forest") || lower.contains("jungle")) {
            elements.add("sacred groves");
            elements.add("ancient trees");
        }
        if (lower.contains("river") || lower.contains("ganga")) {
            elements.add("sacred waters");
            elements.add("spiritual purification");
        }
        if (lower.contains("mountain") || lower.contains("himalaya") || lower.contains("hill")) {
            elements.add("sacred peaks");
            elements.add("divine abodes");
        }
        return elements;
    }
}
