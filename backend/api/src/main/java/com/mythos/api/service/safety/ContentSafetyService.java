package com.mythos.api.service.safety;

import com.mythos.api.service.evaluation.EvaluationOutcome;
import com.mythos.api.service.evaluation.EvaluatorFault;
import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.provider.ModerationResult;
import com.mythos.api.service.provider.ProviderMode;
import com.mythos.common.prompt.CharacterProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 콘텐츠 안전성 평가 서비스
 *
 * 규칙 기반 점수 (100점 시작):
 * - 매치된 부적절 단어 그룹당 -20 (같은 그룹 반복은 1회)
 * - 단어 수 부족(3 미만) -10, 초과(문맥별 최대값) -15
 * - 신화 관련 키워드 없음 -25
 * - 0점 하한, 70점 이상 통과
 *
 * live 모드에서는 provider 모더레이션 결과도 반영
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentSafetyService {

    static final int START_SCORE = 100;
    static final int PENALTY_PER_GROUP = 20;
    static final int PENALTY_TOO_SHORT = 10;
    static final int PENALTY_TOO_LONG = 15;
    static final int PENALTY_NO_MYTHOLOGY = 25;

    static final List<String> MYTHOLOGY_KEYWORDS = List.of(
            "krishna", "rama", "hanuman", "shiva", "durga", "ganesha",
            "mahabharata", "ramayana", "bhagavad gita", "vedas", "upanishads",
            "temple", "ashram", "guru", "yoga", "meditation", "dharma",
            "karma", "moksha", "bhakti", "deva", "asura", "avatar"
    );

    private static final String EVALUATOR_NAME = "content-safety";

    private final GenerationProvider generationProvider;

    /**
     * 규칙 기반 평가 (텍스트와 고정 규칙표만으로 결정)
     */
    public SafetyVerdict evaluate(String text, SafetyContext context) {
        String content = text == null ? "" : text;
        int score = START_SCORE;
        boolean flagged = false;
        List<String> categories = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        for (UnsafeCategory category : UnsafeCategory.values()) {
            int matchedGroups = category.countMatchedGroups(content);
            if (matchedGroups > 0) {
                flagged = true;
                score -= PENALTY_PER_GROUP * matchedGroups;
                categories.add(category.getCode());
                issues.add(category.issue());
                suggestions.add(category.getSuggestion());
            }
        }

        int wordCount = countWords(content);
        if (wordCount < SafetyContext.MIN_WORDS) {
            score -= PENALTY_TOO_SHORT;
            issues.add("Content too short");
            suggestions.add("Provide more descriptive content for better results");
        } else if (wordCount > context.getMaxWords()) {
            score -= PENALTY_TOO_LONG;
            issues.add("Content too long");
            suggestions.add("Keep descriptions concise and focused");
        }

        if (!hasMythologicalElements(content)) {
            score -= PENALTY_NO_MYTHOLOGY;
            issues.add("Content lacks mythological elements");
            suggestions.add("Include references to Indian mythology, characters, or concepts");
        }

        score = Math.max(0, score);
        return SafetyVerdict.builder()
                .passed(score >= SafetyVerdict.PASS_THRESHOLD)
                .score(score)
                .flagged(flagged)
                .categories(categories)
                .issues(issues)
                .suggestions(suggestions)
                .build();
    }

    /**
     * 차단용 검사: 규칙 평가 + (live 모드) provider 모더레이션
     * 모더레이션 호출 실패는 예외 대신 EvaluatorFault 로 반환
     */
    public EvaluationOutcome<SafetyVerdict> screen(String text, SafetyContext context) {
        SafetyVerdict verdict;
        try {
            verdict = evaluate(text, context);
        } catch (RuntimeException e) {
            log.warn("[Safety] Rule evaluation failed: {}", e.getMessage());
            return EvaluationOutcome.fault(EvaluatorFault.of(EVALUATOR_NAME, e));
        }

        if (!verdict.isPassed() || generationProvider.getMode() != ProviderMode.LIVE) {
            return EvaluationOutcome.of(verdict);
        }

        ModerationResult moderation;
        try {
            moderation = generationProvider.moderate(text);
        } catch (RuntimeException e) {
            log.warn("[Safety] Moderation call failed: {}", e.getMessage());
            return EvaluationOutcome.fault(EvaluatorFault.of("moderation", e));
        }

        if (moderation.isSafe()) {
            return EvaluationOutcome.of(verdict);
        }

        List<String> categories = new ArrayList<>(verdict.getCategories());
        moderation.getCategories().forEach(c -> categories.add("moderation:" + c));
        List<String> issues = new ArrayList<>(verdict.getIssues());
        issues.add("Flagged by content moderation");
        List<String> suggestions = new ArrayList<>(verdict.getSuggestions());
        suggestions.add("Keep content family-friendly and appropriate");

        log.info("[Safety] Moderation flagged content - categories: {}", moderation.getCategories());
        return EvaluationOutcome.of(verdict.toBuilder()
                .passed(false)
                .flagged(true)
                .categories(categories)
                .issues(issues)
                .suggestions(suggestions)
                .build());
    }

    /**
     * 신화 묘사 정확성 검사 (캐릭터는 텍스트에서 인식)
     */
    public AccuracyCheck checkMythologyAccuracy(String text) {
        return checkMythologyAccuracy(text, CharacterProfile.recognize(text).orElse(null));
    }

    public AccuracyCheck checkMythologyAccuracy(String text, CharacterProfile character) {
        String lower = lower(text);
        boolean accurate = true;
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        List<String> culturalContext = new ArrayList<>();

        if (character == CharacterProfile.KRISHNA) {
            if (lower.contains("evil") || lower.contains("destructive")) {
                accurate = false;
                issues.add("Krishna is typically portrayed as benevolent and protective");
                suggestions.add("Focus on Krishna's divine nature and protective qualities");
            }
            culturalContext.addAll(List.of("Vaishnavism", "Bhagavad Gita", "Bhakti tradition"));
        } else if (character == CharacterProfile.HANUMAN) {
            if (lower.contains("disloyal") || lower.contains("corrupt")) {
                accurate = false;
                issues.add("Hanuman is known for his unwavering loyalty and devotion");
                suggestions.add("Emphasize Hanuman's loyalty and devotion to Rama");
            }
            culturalContext.addAll(List.of("Ramayana", "Bhakti", "Devotion"));
        } else if (character == CharacterProfile.SHIVA) {
            if (lower.contains("evil") || lower.contains("corrupt")) {
                accurate = false;
                issues.add("Shiva is a complex deity, not inherently evil");
                suggestions.add("Focus on Shiva's role as destroyer of ignorance and ego");
            }
            culturalContext.addAll(List.of("Shaivism", "Yoga", "Meditation"));
        }

        if (lower.contains("caste") || lower.contains("untouchable")) {
            accurate = false;
            issues.add("Avoid references to caste discrimination");
            suggestions.add("Focus on universal spiritual values and divine qualities");
        }

        if (lower.contains("idol")) {
            suggestions.add("Use \"deity\" or \"divine image\" instead of \"idol\"");
        }

        return AccuracyCheck.builder()
                .accurate(accurate)
                .issues(issues)
                .suggestions(suggestions)
                .culturalContext(culturalContext)
                .build();
    }

    /**
     * 신화적 깊이를 더하기 위한 보강 제안
     */
    public List<String> enhancementSuggestions(String text) {
        String lower = lower(text);
        List<String> suggestions = new ArrayList<>();

        if (!lower.contains("divine") && !lower.contains("sacred")) {
            suggestions.add("Add divine or sacred elements to enhance mythological significance");
        }
        if (!lower.contains("ancient") && !lower.contains("traditional")) {
            suggestions.add("Include references to ancient or traditional aspects");
        }
        if (!lower.contains("spiritual") && !lower.contains("cosmic")) {
            suggestions.add("Add spiritual or cosmic elements for deeper meaning");
        }

        if (CharacterProfile.KRISHNA.mentionedIn(text)) {
            suggestions.add("Mention Krishna's divine nature and protective qualities");
        }
        if (CharacterProfile.HANUMAN.mentionedIn(text)) {
            suggestions.add("Emphasize Hanuman's devotion and strength");
        }
        if (CharacterProfile.SHIVA.mentionedIn(text)) {
            suggestions.add("Include Shiva's yogic and cosmic aspects");
        }
        return suggestions;
    }

    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    static boolean hasMythologicalElements(String text) {
        String lower = lower(text);
        return MYTHOLOGY_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
