package com.mythos.api.service.quality;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 품질 규칙 공용 텍스트 매칭
 */
final class TextMatch {

    private TextMatch() {}

    static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    static boolean containsAny(String lowerText, Collection<String> terms) {
        return terms.stream().anyMatch(lowerText::contains);
    }

    static boolean containsWord(String lowerText, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(lowerText).find();
    }
}
