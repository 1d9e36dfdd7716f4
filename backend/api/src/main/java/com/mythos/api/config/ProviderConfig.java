package com.mythos.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.provider.OpenAiProvider;
import com.mythos.api.service.provider.ProviderSettings;
import com.mythos.api.service.provider.SyntheticProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 생성 provider 선택 (기동 시 한 번)
 *
 * - mythos.provider.mode=synthetic → synthetic
 * - API 키가 설정되어 있고 placeholder가 아니면 → live
 * - 그 외 → synthetic
 */
@Slf4j
@Configuration
public class ProviderConfig {

    public static final String PLACEHOLDER_API_KEY = "your_openai_api_key_here";

    @Value("${mythos.provider.mode:auto}")
    private String mode;

    @Value("${mythos.provider.api-key:}")
    private String apiKey;

    @Value("${mythos.provider.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${mythos.provider.timeout-ms:30000}")
    private long timeoutMs;

    @Value("${mythos.provider.total-timeout-ms:45000}")
    private long totalTimeoutMs;

    @Value("${mythos.provider.max-retries:2}")
    private int maxRetries;

    @Value("${mythos.provider.temperature:0.7}")
    private double temperature;

    @Value("${mythos.provider.max-tokens:500}")
    private int maxTokens;

    @Value("${mythos.provider.image.model:dall-e-3}")
    private String imageModel;

    @Value("${mythos.provider.image.size:1024x1024}")
    private String imageSize;

    @Value("${mythos.provider.image.quality:hd}")
    private String imageQuality;

    @Value("${mythos.provider.image.style:vivid}")
    private String imageStyle;

    @Bean
    public GenerationProvider generationProvider(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        if ("synthetic".equalsIgnoreCase(mode)) {
            log.info("[Provider] Mode: SYNTHETIC (forced by mythos.provider.mode)");
            return new SyntheticProvider(objectMapper);
        }
        if (!hasUsableApiKey(apiKey)) {
            log.warn("[Provider] Mode: SYNTHETIC (no provider API key configured)");
            return new SyntheticProvider(objectMapper);
        }

        ProviderSettings settings = ProviderSettings.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .timeoutMs(timeoutMs)
                .totalTimeoutMs(totalTimeoutMs)
                .maxRetries(maxRetries)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .imageModel(imageModel)
                .imageSize(imageSize)
                .imageQuality(imageQuality)
                .imageStyle(imageStyle)
                .build();

        log.info("[Provider] Mode: LIVE (base URL: {}, timeout: {}ms per attempt / {}ms total, max retries: {})",
                baseUrl, timeoutMs, totalTimeoutMs, maxRetries);
        return new OpenAiProvider(webClientBuilder, objectMapper, settings);
    }

    public static boolean hasUsableApiKey(String key) {
        return key != null && !key.isBlank() && !PLACEHOLDER_API_KEY.equals(key.trim());
    }
}
