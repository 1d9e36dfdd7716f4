package com.mythos.api.service.pipeline;

import com.mythos.common.enums.ErrorType;
import com.mythos.common.exception.ApiException;
import lombok.Getter;

/**
 * 파이프라인 거부 - 사유 코드, 거부 직전 상태, 실패 단계, (rate limit 시) 리셋 시각
 * 메시지는 클라이언트에 그대로 반환되므로 내부 오류 상세를 담지 않음
 */
@Getter
public class GenerationRejectedException extends ApiException {

    private final RejectReason reason;
    private final PipelineState state;
    private final ErrorType errorType;
    private final Long resetAt;

    public GenerationRejectedException(RejectReason reason, PipelineState state, ErrorType errorType,
                                       String message, Long resetAt) {
        super(reason.getErrorCode(), message);
        this.reason = reason;
        this.state = state;
        this.errorType = errorType;
        this.resetAt = resetAt;
    }
}
