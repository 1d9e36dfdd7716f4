package com.mythos.api.service.safety;

import lombok.Getter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 부적절 콘텐츠 카테고리 (단어 경계 기준, 대소문자 무시)
 * 카테고리는 하나 이상의 단어 그룹으로 구성되며, 그룹 단위로 매치 여부를 판정
 */
@Getter
public enum UnsafeCategory {

    VIOLENCE("violence",
            List.of(List.of("kill", "murder", "death", "blood", "gore", "torture", "pain", "suffering"),
                    List.of("war", "battle", "fight", "attack", "destroy", "crush", "smash", "burn")),
            "Consider using more peaceful language or focusing on the spiritual aspects"),

    SEXUAL("sexual",
            List.of(List.of("sex", "sexual", "nude", "naked", "intimate", "romance", "love", "kiss")),
            "Focus on the divine and spiritual aspects of the story"),

    HATEFUL("hateful",
            List.of(List.of("hate", "racist", "discriminate", "insult", "curse", "swear")),
            "Use respectful and inclusive language"),

    SUBSTANCE("substance",
            List.of(List.of("drug", "alcohol", "smoke", "drunk", "high")),
            "Keep content family-friendly and appropriate");

    private final String code;
    private final String suggestion;
    private final List<Pattern> patterns;

    UnsafeCategory(String code, List<List<String>> wordGroups, String suggestion) {
        this.code = code;
        this.suggestion = suggestion;
        this.patterns = wordGroups.stream()
                .map(words -> Pattern.compile("\\b(" + String.join("|", words) + ")\\b", Pattern.CASE_INSENSITIVE))
                .toList();
    }

    /**
     * 매치된 단어 그룹 수 (같은 그룹의 반복 매치는 1회)
     */
    public int countMatchedGroups(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) patterns.stream()
                .filter(pattern -> pattern.matcher(text).find())
                .count();
    }

    public String issue() {
        return "Contains " + code + " content";
    }
}
