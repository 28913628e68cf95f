package com.ryuqq.uploadgate.core.policy;

import java.util.Optional;

/**
 * 중복 발견 시 설정된 동작.
 *
 * <p>설정 문서의 "action" 값과 정확히 일치해야 합니다 (대소문자 구분).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum GateAction {

    BLOCK("block"),
    WARN("warn");

    private final String value;

    GateAction(String value) {
        this.value = value;
    }

    /**
     * 설정 문자열 값.
     *
     * @return "block" 또는 "warn"
     */
    public String getValue() {
        return value;
    }

    /**
     * 설정 문자열로부터 GateAction 조회.
     *
     * @param value 설정 값 (null 허용)
     * @return 일치하는 GateAction, 알 수 없는 값이면 Optional.empty()
     */
    public static Optional<GateAction> from(String value) {
        for (GateAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
