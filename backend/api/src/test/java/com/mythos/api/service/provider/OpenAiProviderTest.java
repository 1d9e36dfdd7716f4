package com.mythos.api.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mythos.common.enums.SceneCategory;
import com.mythos.common.enums.StyleCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OpenAiProvider")
class OpenAiProviderTest {

    private static final ScriptPrompt PROMPT = ScriptPrompt.builder()
            .scene("Krishna lifts the hill")
            .sceneCategory(SceneCategory.GENERAL)
            .systemPrompt("system")
            .userPrompt("user")
            .build();

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("HTTP 오류 분류")
    void classifiesErrors() {
        assertThat(OpenAiProvider.classify(404, "{\"error\":{\"code\":\"model_not_found\"}}").getType())
                .isEqualTo(ProviderErrorType.MODEL_NOT_FOUND);
        assertThat(OpenAiProvider.classify(404, "The model `gpt-x` does not exist").getType())
                .isEqualTo(ProviderErrorType.MODEL_NOT_FOUND);
        assertThat(OpenAiProvider.classify(401, "invalid key").getType())
                .isEqualTo(ProviderErrorType.UNAUTHORIZED);
        assertThat(OpenAiProvider.classify(400, "{\"code\":\"content_policy_violation\"}").getType())
                .isEqualTo(ProviderErrorType.CONTENT_POLICY);

        ProviderException overloaded = OpenAiProvider.classify(503, "overloaded");
        assertThat(overloaded.getType()).isEqualTo(ProviderErrorType.TRANSPORT);
        assertThat(overloaded.isRetryable()).isTrue();
        assertThat(OpenAiProvider.classify(429, "slow down").isRetryable()).isTrue();
        assertThat(OpenAiProvider.classify(400, "bad request").isRetryable()).isFalse();
    }

    @Test
    @DisplayName("chat completion 응답에서 content 추출")
    void extractsCompletionContent() {
        OpenAiProvider provider = providerReturning(
                HttpStatus.OK, "{\"choices\":[{\"message\":{\"content\":\"{\\\"narrator_caption\\\":\\\"x\\\"}\"}}]}", 0);

        assertThat(provider.completeText(PROMPT, "gpt-4o-mini")).isEqualTo("{\"narrator_caption\":\"x\"}");
        assertThat(provider.getMode()).isEqualTo(ProviderMode.LIVE);
    }

    @Test
    @DisplayName("빈 content는 EMPTY_RESPONSE")
    void emptyContentFails() {
        OpenAiProvider provider = providerReturning(HttpStatus.OK, "{\"choices\":[]}", 0);

        assertThatThrownBy(() -> provider.completeText(PROMPT, "gpt-4o-mini"))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getType())
                .isEqualTo(ProviderErrorType.EMPTY_RESPONSE);
    }

    @Test
    @DisplayName("모델 미존재는 재시도 없이 MODEL_NOT_FOUND")
    void modelNotFoundIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        OpenAiProvider provider = provider(request -> {
            calls.incrementAndGet();
            return Mono.just(response(HttpStatus.NOT_FOUND, "{\"error\":{\"code\":\"model_not_found\"}}"));
        }, 2);

        assertThatThrownBy(() -> provider.completeText(PROMPT, "gpt-4o-mini"))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).isModelNotFound())
                .isEqualTo(true);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("5xx는 재시도 후 성공")
    void retriesServerErrors() {
        AtomicInteger calls = new AtomicInteger();
        OpenAiProvider provider = provider(request -> {
            if (calls.incrementAndGet() == 1) {
                return Mono.just(response(HttpStatus.SERVICE_UNAVAILABLE, "overloaded"));
            }
            return Mono.just(response(HttpStatus.OK, "{\"data\":[{\"url\":\"https://img.example/1.png\"}]}"));
        }, 2);

        ImagePrompt prompt = ImagePrompt.builder().visualDescription("d").prompt("p").build();

        assertThat(provider.synthesizeImage(prompt, StyleCategory.VIBRANT))
                .isEqualTo("https://img.example/1.png");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("모더레이션: 차단 카테고리가 true면 unsafe")
    void moderationReportsUnsafeCategories() {
        OpenAiProvider provider = providerReturning(HttpStatus.OK,
                "{\"results\":[{\"flagged\":true,\"categories\":{\"violence\":true,\"harassment\":false}}]}", 0);

        ModerationResult result = provider.moderate("text");

        assertThat(result.isSafe()).isFalse();
        assertThat(result.isFlagged()).isTrue();
        assertThat(result.getCategories()).containsExactly("violence");
    }

    @Test
    @DisplayName("응답이 timeout을 넘으면 TIMEOUT")
    void timesOut() {
        OpenAiProvider provider = new OpenAiProvider(
                WebClient.builder().exchangeFunction(request ->
                        Mono.just(response(HttpStatus.OK, "{}")).delayElement(Duration.ofSeconds(5))),
                objectMapper,
                settings(50, 0));

        assertThatThrownBy(() -> provider.moderate("text"))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getType())
                .isEqualTo(ProviderErrorType.TIMEOUT);
    }

    @Test
    @DisplayName("재시도를 포함한 전체 호출이 total timeout을 넘으면 TIMEOUT")
    void retriesStopAtTotalTimeout() {
        AtomicInteger calls = new AtomicInteger();
        OpenAiProvider provider = new OpenAiProvider(
                WebClient.builder().exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(response(HttpStatus.SERVICE_UNAVAILABLE, "overloaded"))
                            .delayElement(Duration.ofMillis(100));
                }),
                objectMapper,
                settings(1000, 300, 5));

        assertThatThrownBy(() -> provider.moderate("text"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("total budget")
                .extracting(e -> ((ProviderException) e).getType())
                .isEqualTo(ProviderErrorType.TIMEOUT);
        assertThat(calls.get()).isBetween(1, 2);
    }

    private OpenAiProvider providerReturning(HttpStatus status, String body, int maxRetries) {
        return provider(request -> Mono.just(response(status, body)), maxRetries);
    }

    private OpenAiProvider provider(ExchangeFunction exchange, int maxRetries) {
        return new OpenAiProvider(WebClient.builder().exchangeFunction(exchange), objectMapper, settings(2000, maxRetries));
    }

    private static ProviderSettings settings(long timeoutMs, int maxRetries) {
        return settings(timeoutMs, timeoutMs * 10, maxRetries);
    }

    private static ProviderSettings settings(long timeoutMs, long totalTimeoutMs, int maxRetries) {
        return ProviderSettings.builder()
                .baseUrl("https://provider.test/v1")
                .apiKey("sk-test")
                .timeoutMs(timeoutMs)
                .totalTimeoutMs(totalTimeoutMs)
                .maxRetries(maxRetries)
                .temperature(0.7)
                .maxTokens(500)
                .imageModel("dall-e-3")
                .imageSize("1024x1024")
                .imageQuality("hd")
                .imageStyle("vivid")
                .build();
    }

    private static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
