package com.mythos.api.service.safety;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 신화 묘사 정확성 검사 결과 (참고용, 차단하지 않음)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccuracyCheck {

    private boolean accurate;
    @Builder.Default
    private List<String> issues = new ArrayList<>();
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
    @Builder.Default
    private List<String> culturalContext = new ArrayList<>();
}
