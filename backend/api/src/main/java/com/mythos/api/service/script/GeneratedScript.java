package com.mythos.api.service.script;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mythos.api.service.provider.SyntheticScript;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 만화 패널 스크립트 (내레이션 캡션, 대사, 이미지 묘사)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedScript {

    @JsonProperty("narrator_caption")
    private String narration;

    private String dialogue;  // 없으면 빈 문자열

    @JsonProperty("image_description")
    private String visualDescription;

    public static GeneratedScript from(SyntheticScript script) {
        return new GeneratedScript(script.getNarration(), script.getDialogue(), script.getVisualDescription());
    }

    /**
     * 품질/정확성 검사 대상 텍스트 (캡션 + 묘사)
     */
    public String combinedText() {
        return (narration == null ? "" : narration) + " " + (visualDescription == null ? "" : visualDescription);
    }
}
