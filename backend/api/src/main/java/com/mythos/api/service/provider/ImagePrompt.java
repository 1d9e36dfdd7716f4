package com.mythos.api.service.provider;

import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import lombok.Builder;
import lombok.Getter;

/**
 * 이미지 생성 요청 (원본 시각 묘사 + 스타일이 합쳐진 최종 프롬프트)
 */
@Getter
@Builder
public class ImagePrompt {

    private final String visualDescription;
    private final SceneCategory sceneCategory;
    private final StyleCategory styleCategory;
    private final String prompt;
}
