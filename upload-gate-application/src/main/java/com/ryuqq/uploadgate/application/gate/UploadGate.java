package com.ryuqq.uploadgate.application.gate;

import com.ryuqq.uploadgate.core.model.UploadEvent;

/**
 * 업로드 게이트.
 *
 * <p>업로드 요청을 받아 페더레이션 전체에서 중복 여부를 확인하고,
 * 설정된 정책에 따라 진행/차단/경고를 결정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UploadEvent event = UploadEvent.of("libs-release", "com/acme/app/1.0/app-1.0.jar");
 * GateResponse response = gate.evaluate(event);
 *
 * if (response.status() == GateStatus.STOP) {
 *     // 업로드 거부 + response.message()
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface UploadGate {

    /**
     * 업로드 요청 평가.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>필수 식별 정보 검증 (실패 시 STOP)</li>
     *   <li>설정 로드 및 파싱 (실패 시 빈 설정)</li>
     *   <li>검색 범위 계산 (비어 있으면 즉시 PROCEED)</li>
     *   <li>관련 JPD 병렬 검색</li>
     *   <li>정책 판정</li>
     * </ol>
     *
     * <p>이 메서드는 예외를 던지지 않습니다. 내부 오류는 STOP 응답으로 변환됩니다.</p>
     *
     * @param event 업로드 이벤트 (null 허용, STOP 처리)
     * @return 게이트 응답
     */
    GateResponse evaluate(UploadEvent event);
}
