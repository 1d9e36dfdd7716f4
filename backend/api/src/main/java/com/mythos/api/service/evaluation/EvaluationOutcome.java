package com.mythos.api.service.evaluation;

import java.util.Optional;

/**
 * 평가 결과 또는 평가기 실패
 *
 * @param <T> 판정 타입 (SafetyVerdict, QualityVerdict)
 */
public final class EvaluationOutcome<T> {

    private final T verdict;
    private final EvaluatorFault fault;

    private EvaluationOutcome(T verdict, EvaluatorFault fault) {
        this.verdict = verdict;
        this.fault = fault;
    }

    public static <T> EvaluationOutcome<T> of(T verdict) {
        return new EvaluationOutcome<>(verdict, null);
    }

    public static <T> EvaluationOutcome<T> fault(EvaluatorFault fault) {
        return new EvaluationOutcome<>(null, fault);
    }

    public boolean isFault() {
        return fault != null;
    }

    public Optional<T> getVerdict() {
        return Optional.ofNullable(verdict);
    }

    public Optional<EvaluatorFault> getFault() {
        return Optional.ofNullable(fault);
    }
}
