package com.mythos.api.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mythos.common.enums.StyleCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * OpenAI 호환 API 어댑터 (chat completions / images / moderations)
 *
 * - 호출마다 timeout 적용, 시간 초과 시 구독 취소
 * - 타임아웃/연결 실패/5xx/429 만 전송 계층 재시도
 * - 모델 미존재는 재시도하지 않고 MODEL_NOT_FOUND 로 올려 호출자가 fallback 모델 선택
 */
@Slf4j
public class OpenAiProvider implements GenerationProvider {

    // 모더레이션 결과 중 차단 대상 카테고리
    private static final List<String> UNSAFE_MODERATION_CATEGORIES = List.of(
            "hate", "hate/threatening", "self-harm", "sexual", "sexual/minors",
            "violence", "violence/graphic"
    );

    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ProviderSettings settings;

    public OpenAiProvider(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, ProviderSettings settings) {
        this.webClient = webClientBuilder
                .baseUrl(settings.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                .build();
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public ProviderMode getMode() {
        return ProviderMode.LIVE;
    }

    @Override
    public String completeText(ScriptPrompt prompt, String model) {
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", prompt.getSystemPrompt()),
                        Map.of("role", "user", "content", prompt.getUserPrompt())
                ),
                "temperature", settings.getTemperature(),
                "max_tokens", settings.getMaxTokens(),
                "response_format", Map.of("type", "json_object")
        );

        log.debug("[Provider] Chat completion request - model: {}", model);
        JsonNode root = post("/chat/completions", requestBody);

        String content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new ProviderException(ProviderErrorType.EMPTY_RESPONSE, "No content in chat completion (model: " + model + ")");
        }
        return content;
    }

    @Override
    public String synthesizeImage(ImagePrompt prompt, StyleCategory style) {
        Map<String, Object> requestBody = Map.of(
                "model", settings.getImageModel(),
                "prompt", prompt.getPrompt(),
                "size", settings.getImageSize(),
                "quality", settings.getImageQuality(),
                "style", settings.getImageStyle(),
                "n", 1
        );

        log.debug("[Provider] Image request - model: {}, style: {}, prompt length: {}",
                settings.getImageModel(), style.getCode(), prompt.getPrompt().length());
        JsonNode root = post("/images/generations", requestBody);

        String url = root.path("data").path(0).path("url").asText("");
        if (url.isBlank()) {
            throw new ProviderException(ProviderErrorType.EMPTY_RESPONSE, "No image URL returned");
        }
        return url;
    }

    @Override
    public ModerationResult moderate(String text) {
        JsonNode root = post("/moderations", Map.of("input", text));

        JsonNode result = root.path("results").path(0);
        if (result.isMissingNode()) {
            throw new ProviderException(ProviderErrorType.EMPTY_RESPONSE, "No moderation result");
        }

        boolean flagged = result.path("flagged").asBoolean(false);
        List<String> hits = new ArrayList<>();
        JsonNode categories = result.path("categories");
        Iterator<Map.Entry<String, JsonNode>> fields = categories.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().asBoolean(false)) {
                hits.add(field.getKey());
            }
        }

        boolean unsafe = hits.stream().anyMatch(UNSAFE_MODERATION_CATEGORIES::contains);
        return new ModerationResult(!unsafe, flagged, hits);
    }

    /**
     * POST 호출 + 응답 JSON 파싱
     * 시도마다 timeoutMs, 재시도까지 합친 전체 호출은 totalTimeoutMs 로 제한
     */
    private JsonNode post(String path, Object body) {
        String response = webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(settings.getTimeoutMs()))
                .onErrorMap(TimeoutException.class, e -> new ProviderException(ProviderErrorType.TIMEOUT,
                        path + " timed out after " + settings.getTimeoutMs() + "ms", e))
                .onErrorMap(WebClientRequestException.class, e -> new ProviderException(ProviderErrorType.TRANSPORT,
                        path + " request failed: " + e.getMessage(), e))
                .retryWhen(Retry.backoff(settings.getMaxRetries(), RETRY_BACKOFF)
                        .filter(e -> e instanceof ProviderException pe && pe.isRetryable())
                        .doBeforeRetry(signal -> log.warn("[Provider] Retrying {} (attempt {}): {}",
                                path, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .timeout(Duration.ofMillis(settings.getTotalTimeoutMs()))
                .onErrorMap(TimeoutException.class, e -> new ProviderException(ProviderErrorType.TIMEOUT,
                        path + " exceeded the total budget of " + settings.getTotalTimeoutMs() + "ms", e))
                .block();

        if (response == null || response.isBlank()) {
            throw new ProviderException(ProviderErrorType.EMPTY_RESPONSE, path + " returned an empty body");
        }

        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderErrorType.TRANSPORT, path + " returned malformed JSON", e);
        }
    }

    /**
     * HTTP 오류 응답 → ProviderException
     */
    private Mono<? extends Throwable> toProviderException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> classify(status, body));
    }

    static ProviderException classify(int status, String body) {
        String lowerBody = body == null ? "" : body.toLowerCase();
        String preview = lowerBody.length() > 300 ? lowerBody.substring(0, 300) : lowerBody;

        if (lowerBody.contains("model_not_found") || (status == 404 && lowerBody.contains("model"))) {
            return new ProviderException(ProviderErrorType.MODEL_NOT_FOUND, "Model not available: " + preview, status, null);
        }
        if (status == 401 || status == 403) {
            return new ProviderException(ProviderErrorType.UNAUTHORIZED, "Provider rejected credentials", status, null);
        }
        if (lowerBody.contains("content_policy_violation") || lowerBody.contains("safety system")) {
            return new ProviderException(ProviderErrorType.CONTENT_POLICY, "Content policy violation: " + preview, status, null);
        }
        return new ProviderException(ProviderErrorType.TRANSPORT, "HTTP " + status + ": " + preview, status, null);
    }
}
