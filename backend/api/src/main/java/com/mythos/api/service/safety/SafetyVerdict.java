package com.mythos.api.service.safety;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 안전성 판정 (score 0-100, score >= 70 이면 통과)
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SafetyVerdict {

    public static final int PASS_THRESHOLD = 70;

    private boolean passed;
    private int score;
    private boolean flagged;
    @Builder.Default
    private List<String> categories = new ArrayList<>();
    @Builder.Default
    private List<String> issues = new ArrayList<>();
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
}
