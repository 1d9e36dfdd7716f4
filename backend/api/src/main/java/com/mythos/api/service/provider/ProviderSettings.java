package com.mythos.api.service.provider;

import lombok.Builder;
import lombok.Getter;

/**
 * Live provider 접속/생성 설정 (mythos.provider.*)
 */
@Getter
@Builder
public class ProviderSettings {

    private final String baseUrl;
    private final String apiKey;
    private final long timeoutMs;          // 시도 1회당
    private final long totalTimeoutMs;     // 재시도 포함 호출 전체
    private final int maxRetries;
    private final double temperature;
    private final int maxTokens;
    private final String imageModel;
    private final String imageSize;
    private final String imageQuality;
    private final String imageStyle;
}
