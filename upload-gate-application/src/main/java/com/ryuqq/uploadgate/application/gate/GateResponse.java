package com.ryuqq.uploadgate.application.gate;

import com.ryuqq.uploadgate.core.model.UploadEvent;
import com.ryuqq.uploadgate.core.policy.Decision;
import com.ryuqq.uploadgate.core.policy.GateStatus;

import java.util.Map;

/**
 * 업로드 게이트 응답.
 *
 * <p>호출자(업로드 처리 플랫폼)에게 반환되는 응답 계약입니다.</p>
 *
 * <ul>
 *   <li><strong>status:</strong> PROCEED, STOP, WARN</li>
 *   <li><strong>message:</strong> 판정 사유</li>
 *   <li><strong>identity:</strong> 업로드 식별 정보 (변경 없음)</li>
 *   <li><strong>headers:</strong> 항상 빈 맵 (응답에 주석을 다는 협력자용으로 예약)</li>
 * </ul>
 *
 * @param status 판정 상태
 * @param message 판정 사유
 * @param identity 업로드 식별 정보 (null 가능)
 * @param headers 응답 헤더
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GateResponse(
    GateStatus status,
    String message,
    UploadEvent identity,
    Map<String, String> headers
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status 또는 message가 null인 경우
     */
    public GateResponse {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * 판정으로부터 응답 생성 (빈 헤더).
     *
     * @param decision 게이트 판정
     * @return GateResponse 인스턴스
     * @throws IllegalArgumentException decision이 null인 경우
     */
    public static GateResponse from(Decision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        return new GateResponse(decision.status(), decision.message(), decision.identity(), Map.of());
    }
}
