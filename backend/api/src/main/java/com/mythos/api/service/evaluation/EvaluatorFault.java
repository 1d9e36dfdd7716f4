package com.mythos.api.service.evaluation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 평가기 자체의 실패 (판정 불가)
 * 파이프라인은 이 경우 fail-open 처리하고 경고 로그를 남김
 */
@Getter
@ToString
@RequiredArgsConstructor
public class EvaluatorFault {

    private final String evaluator;
    private final String detail;

    public static EvaluatorFault of(String evaluator, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new EvaluatorFault(evaluator, message);
    }
}
