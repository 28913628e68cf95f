package com.ryuqq.uploadgate.core.policy;

import com.ryuqq.uploadgate.core.model.FoundItem;
import com.ryuqq.uploadgate.core.model.UploadEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 중복 검색 결과를 게이트 판정으로 변환합니다.
 *
 * <p><strong>판정 표:</strong></p>
 * <pre>
 * found | action        | status
 * ------+---------------+--------
 * false | (any)         | PROCEED
 * true  | "block"       | STOP
 * true  | "warn"        | WARN
 * true  | 기타 / 미설정 | STOP (설정 오류 메시지)
 * </pre>
 *
 * <p>알 수 없는 action은 fail-closed로 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    /**
     * 판정 계산.
     *
     * @param found 중복 발견 여부
     * @param action 설정된 action (null 허용)
     * @param firstMatch 처음 기록된 발견 항목 (found가 false면 비어 있음)
     * @param event 업로드 이벤트
     * @return 게이트 판정
     * @throws IllegalArgumentException event가 null인 경우
     */
    public Decision decide(boolean found, String action, Optional<FoundItem> firstMatch, UploadEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!found) {
            return Decision.proceed("Artifact " + event.path() + " can be uploaded. No duplicates found.", event);
        }

        String message = firstMatch
            .map(item -> "Artifact matching " + event.path() + " already exists in JPD: " + item.location())
            .orElse("Duplicate artifact found. Upload will not proceed.");

        Optional<GateAction> gateAction = GateAction.from(action);
        if (gateAction.isEmpty()) {
            log.warn("Unknown action {} in config. Defaulting to block.", action);
            return Decision.stop("Unknown action '" + action + "' in config. Upload will not proceed.", event);
        }
        if (gateAction.get() == GateAction.WARN) {
            return Decision.warn(message, event);
        }
        return Decision.stop(message, event);
    }
}
