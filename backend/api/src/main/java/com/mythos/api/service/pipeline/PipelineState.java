package com.mythos.api.service.pipeline;

/**
 * 생성 파이프라인 상태
 * IDLE → ADMITTED_SCRIPT → SAFE_INPUT → SCRIPT_GENERATED → STRUCTURALLY_VALID
 *      → ADMITTED_IMAGE → IMAGE_GENERATED → DONE, 모든 관문에서 REJECTED 가능
 */
public enum PipelineState {
    IDLE,
    ADMITTED_SCRIPT,
    SAFE_INPUT,
    SCRIPT_GENERATED,
    STRUCTURALLY_VALID,
    ADMITTED_IMAGE,
    IMAGE_GENERATED,
    DONE,
    REJECTED
}
