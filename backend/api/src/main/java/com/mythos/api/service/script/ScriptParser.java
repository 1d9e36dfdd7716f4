package com.mythos.api.service.script;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * 모델 응답 텍스트 → GeneratedScript 파싱 + 구조 검증
 *
 * 구조 조건: narrator_caption, image_description 은 비어있지 않은 문자열,
 * dialogue 는 문자열(빈 값 허용) 또는 생략
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScriptParser {

    private final ObjectMapper objectMapper;

    /**
     * @return 구조적으로 유효한 스크립트, JSON 오류나 구조 위반이면 empty
     */
    public Optional<GeneratedScript> parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Optional.empty();
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(stripCodeFence(rawText));
        } catch (IOException e) {
            log.warn("[Script] Response is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }

        // 배열로 응답한 경우 첫 번째 요소 사용
        if (node != null && node.isArray() && node.size() > 0) {
            node = node.get(0);
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        JsonNode caption = node.get("narrator_caption");
        JsonNode description = node.get("image_description");
        JsonNode dialogue = node.get("dialogue");

        if (caption == null || !caption.isTextual() || description == null || !description.isTextual()) {
            return Optional.empty();
        }
        if (dialogue != null && !dialogue.isNull() && !dialogue.isTextual()) {
            return Optional.empty();
        }

        GeneratedScript script = GeneratedScript.builder()
                .narration(caption.asText().trim())
                .dialogue(dialogue == null || dialogue.isNull() ? "" : dialogue.asText().trim())
                .visualDescription(description.asText().trim())
                .build();

        return isStructurallyValid(script) ? Optional.of(script) : Optional.empty();
    }

    public static boolean isStructurallyValid(GeneratedScript script) {
        return script != null
                && script.getNarration() != null && !script.getNarration().isBlank()
                && script.getVisualDescription() != null && !script.getVisualDescription().isBlank()
                && script.getDialogue() != null;
    }

    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
