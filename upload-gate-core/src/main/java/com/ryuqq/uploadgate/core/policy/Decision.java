package com.ryuqq.uploadgate.core.policy;

import com.ryuqq.uploadgate.core.model.UploadEvent;

/**
 * 업로드 게이트 판정.
 *
 * <p>모든 판정은 사람이 읽을 수 있는 메시지를 포함합니다 (상태 코드만 반환하지 않음).</p>
 *
 * @param status 판정 상태
 * @param message 판정 사유 메시지
 * @param identity 업로드 식별 정보 (변경 없이 그대로 반환)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Decision(
    GateStatus status,
    String message,
    UploadEvent identity
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status가 null이거나 message가 null/빈 문자열인 경우
     */
    public Decision {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // identity는 null 허용 (요청 자체가 없는 경우)
    }

    /**
     * PROCEED 판정 생성.
     *
     * @param message 메시지
     * @param identity 업로드 식별 정보
     * @return Decision 인스턴스
     */
    public static Decision proceed(String message, UploadEvent identity) {
        return new Decision(GateStatus.PROCEED, message, identity);
    }

    /**
     * STOP 판정 생성.
     *
     * @param message 메시지
     * @param identity 업로드 식별 정보
     * @return Decision 인스턴스
     */
    public static Decision stop(String message, UploadEvent identity) {
        return new Decision(GateStatus.STOP, message, identity);
    }

    /**
     * WARN 판정 생성.
     *
     * @param message 메시지
     * @param identity 업로드 식별 정보
     * @return Decision 인스턴스
     */
    public static Decision warn(String message, UploadEvent identity) {
        return new Decision(GateStatus.WARN, message, identity);
    }
}
