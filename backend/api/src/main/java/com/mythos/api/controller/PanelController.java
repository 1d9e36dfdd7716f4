package com.mythos.api.controller;

import com.mythos.api.dto.PanelDto;
import com.mythos.api.service.pipeline.ComicPanelOrchestrator;
import com.mythos.api.service.provider.GenerationProvider;
import com.mythos.api.service.ratelimit.RateLimitService;
import com.mythos.api.util.ClientIdentityResolver;
import com.mythos.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Comic Panel", description = "신화 만화 패널 생성 API")
public class PanelController {

    private final ComicPanelOrchestrator orchestrator;
    private final RateLimitService rateLimitService;
    private final GenerationProvider generationProvider;
    private final Clock clock;

    @PostMapping("/generate-script")
    @Operation(summary = "스크립트 생성", description = "장면 설명으로 나레이션/대사/이미지 묘사를 생성합니다.")
    public ApiResponse<PanelDto.ScriptResponse> generateScript(@RequestBody PanelDto.ScriptRequest request,
                                                               HttpServletRequest httpRequest) {
        String identity = ClientIdentityResolver.resolve(httpRequest);
        log.info("[PanelController] generate-script from {}", identity);
        return ApiResponse.success(orchestrator.generateScript(request, identity));
    }

    @PostMapping("/generate-image")
    @Operation(summary = "이미지 생성", description = "이미지 묘사와 스타일로 패널 이미지를 생성합니다.")
    public ApiResponse<PanelDto.ImageResponse> generateImage(@RequestBody PanelDto.ImageRequest request,
                                                             HttpServletRequest httpRequest) {
        String identity = ClientIdentityResolver.resolve(httpRequest);
        log.info("[PanelController] generate-image from {}", identity);
        return ApiResponse.success(orchestrator.generateImage(request, identity));
    }

    @PostMapping("/complete-comic-panel")
    @Operation(summary = "패널 통합 생성", description = "스크립트와 이미지를 한 번에 생성합니다.")
    public ApiResponse<PanelDto.CompletePanelResponse> completePanel(@RequestBody PanelDto.CompletePanelRequest request,
                                                                     HttpServletRequest httpRequest) {
        String identity = ClientIdentityResolver.resolve(httpRequest);
        log.info("[PanelController] complete-comic-panel from {}", identity);
        return ApiResponse.success(orchestrator.completePanel(request, identity));
    }

    @PostMapping("/reset-rate-limits")
    @Operation(summary = "Rate limit 초기화", description = "개발 환경에서만 모든 rate limit 카운터를 초기화합니다.")
    public ApiResponse<PanelDto.ResetResponse> resetRateLimits() {
        long resetAt = rateLimitService.resetAll();
        PanelDto.ResetResponse response = PanelDto.ResetResponse.builder()
                .message("Rate limits reset successfully")
                .timestamp(Instant.ofEpochMilli(resetAt))
                .build();
        return ApiResponse.success(response);
    }

    @GetMapping("/health")
    @Operation(summary = "헬스 체크", description = "서비스 상태, provider 모드, 배포 프로파일을 반환합니다.")
    public ApiResponse<PanelDto.HealthResponse> health() {
        PanelDto.HealthResponse response = PanelDto.HealthResponse.builder()
                .status("OK")
                .providerMode(generationProvider.getMode().getCode())
                .profile(rateLimitService.getProfile().getCode())
                .timestamp(clock.instant())
                .build();
        return ApiResponse.success(response);
    }
}
