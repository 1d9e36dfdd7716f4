package com.mythos.api.service.script;

import com.mythos.api.service.provider.ScriptPrompt;
import com.mythos.common.enums.SceneCategory;
import org.springframework.stereotype.Component;

/**
 * 스크립트 생성 프롬프트 (strict JSON 3개 키 요구 + 장면 분류별 프레이밍)
 */
@Component
public class ScriptPromptBuilder {

    static final String SYSTEM_PROMPT =
            "You are a master scriptwriter specializing in Indian mythology comics. Always return valid JSON.";

    private static final String USER_PROMPT_TEMPLATE = """
            You are a master scriptwriter specializing in Indian mythology comics, combining the dramatic storytelling of Amar Chitra Katha with the visual intensity of modern graphic novels.

            TASK: Transform the user's scene into a single comic panel with three precise components.

            USER SCENE: "%s"

            REQUIREMENTS:
            - Focus on ONE dramatic moment
            - Emphasize visual storytelling over exposition
            - Capture the mythological grandeur and emotional weight
            - Use authentic Indian cultural details

            OUTPUT FORMAT: JSON with exactly these keys:

            {
              "narrator_caption": "[15-25 words] Third-person dramatic narration for caption box. Focus on the mythological significance and emotional weight of the moment.",
              "dialogue": "[0-15 words] One powerful line spoken by the main character. If no dialogue fits naturally, return empty string. Make it memorable and character-defining.",
              "image_description": "[40-60 words] Vivid scene description for image AI. Include: character appearance, action/pose, facial expression, setting details, lighting/atmosphere, and any magical/divine elements. Describe only what's visible, not the art style."
            }

            STYLE NOTES:
            - Narrator should sound like classic mythology storytelling
            - Dialogue should be profound, not casual
            - Image description should emphasize drama and scale
            - Include authentic details (clothing, architecture, weapons, etc.)

            Return only valid JSON.""";

    private static final String ACTION_FRAMING = """


            SCENE TYPE: High-action battle or physical feat
            FOCUS: Dynamic movement, power display, environmental impact
            EMOTIONAL TONE: Heroic determination, divine fury, or mythic grandeur""";

    private static final String SPIRITUAL_FRAMING = """


            SCENE TYPE: Spiritual transformation or emotional revelation
            FOCUS: Character expressions, divine manifestations, symbolic elements
            EMOTIONAL TONE: Reverence, enlightenment, cosmic significance""";

    public ScriptPrompt build(String scene, SceneCategory category) {
        StringBuilder userPrompt = new StringBuilder(String.format(USER_PROMPT_TEMPLATE, scene.replace("\"", "'")));

        if (category == SceneCategory.ACTION) {
            userPrompt.append(ACTION_FRAMING);
        } else if (category == SceneCategory.SPIRITUAL) {
            userPrompt.append(SPIRITUAL_FRAMING);
        }

        return ScriptPrompt.builder()
                .scene(scene)
                .sceneCategory(category)
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(userPrompt.toString())
                .build();
    }
}
