package com.mythos.api.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 배포 프로파일 (mythos.deployment-profile)
 * 개발 환경은 rate limit 한도가 높고 관리용 리셋이 허용됨
 */
@Getter
@RequiredArgsConstructor
public enum DeploymentProfile {

    DEVELOPMENT("development", 50, 20),
    PRODUCTION("production", 10, 5);

    private final String code;
    private final int defaultScriptCeiling;
    private final int defaultImageCeiling;

    public boolean isProduction() {
        return this == PRODUCTION;
    }

    public static DeploymentProfile fromCode(String code) {
        if (code != null && (code.equalsIgnoreCase("production") || code.equalsIgnoreCase("prod"))) {
            return PRODUCTION;
        }
        return DEVELOPMENT;
    }
}
