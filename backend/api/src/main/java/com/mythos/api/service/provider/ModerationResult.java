package com.mythos.api.service.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Provider 모더레이션 결과
 */
@Getter
@RequiredArgsConstructor
public class ModerationResult {

    private final boolean safe;
    private final boolean flagged;
    private final List<String> categories;  // true로 판정된 카테고리

    public static ModerationResult passed() {
        return new ModerationResult(true, false, List.of());
    }
}
