package com.ryuqq.uploadgate.core.policy;

/**
 * 업로드 게이트 판정 상태.
 *
 * <ul>
 *   <li>{@link #PROCEED}: 업로드 허용</li>
 *   <li>{@link #STOP}: 업로드 차단</li>
 *   <li>{@link #WARN}: 업로드 허용 + 경고</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum GateStatus {

    PROCEED,
    STOP,
    WARN;

    /**
     * 업로드가 진행되는지 확인.
     *
     * @return STOP이 아니면 true
     */
    public boolean allowsUpload() {
        return this != STOP;
    }
}
