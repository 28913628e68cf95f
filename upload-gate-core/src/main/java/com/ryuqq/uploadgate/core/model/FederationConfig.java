package com.ryuqq.uploadgate.core.model;

import java.util.List;
import java.util.Optional;

/**
 * 페더레이션 검색 설정.
 *
 * <p>업로드 이벤트마다 새로 읽어 재구성합니다 (이벤트 간 캐시 없음).
 * 설정 변경은 다음 실행부터 반영됩니다.</p>
 *
 * <p><strong>action:</strong> 저장 형태는 자유 문자열입니다 ("block", "warn").
 * 알 수 없는 값이나 null이어도 범위 계산은 중단되지 않으며, 정책 결정 단계에서만
 * 영향을 줍니다 (중복 발견 시 STOP).</p>
 *
 * @param targets JPD 목록 (설정 순서 유지)
 * @param action 중복 발견 시 동작 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FederationConfig(
    List<FederationTarget> targets,
    String action
) {

    /** 설정을 읽지 못했을 때 사용하는 기본 action. */
    public static final String DEFAULT_ACTION = "warn";

    /**
     * Compact Constructor.
     */
    public FederationConfig {
        targets = targets == null ? List.of() : List.copyOf(targets);
        // action은 null 허용
    }

    /**
     * 빈 설정 (대상 없음, action = warn).
     *
     * <p>설정 로드/파싱 실패 시 fail-open 기본값으로 사용합니다.</p>
     *
     * @return 빈 FederationConfig
     */
    public static FederationConfig empty() {
        return new FederationConfig(List.of(), DEFAULT_ACTION);
    }

    /**
     * 지정한 저장소를 선언한 JPD 목록 조회.
     *
     * @param repoName 저장소 이름
     * @return 해당 저장소를 repos에 포함한 대상 목록 (설정 순서)
     */
    public List<FederationTarget> targetsForRepo(String repoName) {
        return targets.stream()
            .filter(target -> target.repos().stream().anyMatch(r -> r.repoName().equals(repoName)))
            .toList();
    }

    /**
     * 대상 JPD 안에서 저장소 범위 조회.
     *
     * @param target JPD
     * @param repoName 저장소 이름
     * @return 첫 번째로 일치하는 RepoScope
     */
    public Optional<RepoScope> repoScope(FederationTarget target, String repoName) {
        return target.repos().stream()
            .filter(r -> r.repoName().equals(repoName))
            .findFirst();
    }

    /**
     * 설정된 대상이 없는지 확인.
     *
     * @return 대상이 없으면 true
     */
    public boolean isEmpty() {
        return targets.isEmpty();
    }
}
