package com.mythos.api.service.ratelimit;

import com.mythos.api.config.DeploymentProfile;
import com.mythos.common.exception.ApiException;
import com.mythos.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * 클라이언트 요청 수 제한 서비스
 *
 * 핵심 기능:
 * 1. 스크립트/이미지 단계 별도 카운터 (고정 윈도우)
 * 2. 주기적 만료 항목 정리
 * 3. 관리용 전체 리셋 (production 프로파일에서는 금지)
 *
 * 한도 설정값이 0이면 배포 프로파일 기본값 사용 (production 10/5, development 50/20)
 */
@Slf4j
@Service
public class RateLimitService {

    public static final String SCRIPT_LIMITER = "script";
    public static final String IMAGE_LIMITER = "image";

    private final FixedWindowRateLimiter scriptLimiter;
    private final FixedWindowRateLimiter imageLimiter;
    private final DeploymentProfile profile;
    private final Clock clock;

    public RateLimitService(
            QuotaStoreFactory storeFactory,
            Clock clock,
            @Value("${mythos.deployment-profile:development}") String deploymentProfile,
            @Value("${mythos.rate-limit.window-ms:60000}") long windowMs,
            @Value("${mythos.rate-limit.script.requests-per-window:0}") int scriptCeiling,
            @Value("${mythos.rate-limit.image.requests-per-window:0}") int imageCeiling) {
        this.profile = DeploymentProfile.fromCode(deploymentProfile);
        this.clock = clock;

        int resolvedScript = scriptCeiling > 0 ? scriptCeiling : profile.getDefaultScriptCeiling();
        int resolvedImage = imageCeiling > 0 ? imageCeiling : profile.getDefaultImageCeiling();

        this.scriptLimiter = new FixedWindowRateLimiter(
                SCRIPT_LIMITER, resolvedScript, windowMs, storeFactory.create(SCRIPT_LIMITER), clock);
        this.imageLimiter = new FixedWindowRateLimiter(
                IMAGE_LIMITER, resolvedImage, windowMs, storeFactory.create(IMAGE_LIMITER), clock);

        log.info("[RateLimitService] Initialized - profile: {}, script: {}/{}ms, image: {}/{}ms",
                profile.getCode(), resolvedScript, windowMs, resolvedImage, windowMs);
    }

    public AdmissionDecision checkScript(String identity) {
        return scriptLimiter.check(identity);
    }

    public AdmissionDecision checkImage(String identity) {
        return imageLimiter.check(identity);
    }

    /**
     * 만료된 윈도우 정리 (진행 중인 검사를 막지 않음)
     */
    @Scheduled(fixedRateString = "${mythos.rate-limit.sweep-interval-ms:60000}")
    public void sweepExpired() {
        int removedScript = scriptLimiter.sweep();
        int removedImage = imageLimiter.sweep();
        if (removedScript + removedImage > 0) {
            log.debug("[RateLimitService] Sweep removed {} script, {} image entries", removedScript, removedImage);
        }
    }

    /**
     * 두 카운터 테이블 전체 리셋
     * @return 리셋 시각 (epoch millis)
     * @throws ApiException production 프로파일인 경우 FORBIDDEN
     */
    public long resetAll() {
        if (profile.isProduction()) {
            log.warn("[RateLimitService] Reset rejected in production profile");
            throw new ApiException(ErrorCode.FORBIDDEN, "Rate limit reset is not available in production");
        }
        scriptLimiter.reset();
        imageLimiter.reset();
        long resetAt = clock.millis();
        log.info("[RateLimitService] All rate limits reset at {}", resetAt);
        return resetAt;
    }

    public List<FixedWindowRateLimiter.LimiterStats> getAllStats() {
        return List.of(scriptLimiter.getStats(), imageLimiter.getStats());
    }

    public DeploymentProfile getProfile() {
        return profile;
    }
}
