package com.ryuqq.uploadgate.core.model;

import java.util.Optional;

/**
 * 범위 계산 결과 항목 (JPD + 선택적 저장소 범위).
 *
 * <p>repoScope가 없으면 "이 JPD의 업로드 저장소를 제한 없이 검색"을 의미합니다.</p>
 *
 * @param target 검색할 JPD
 * @param repoScope 저장소 범위 (없으면 Optional.empty())
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScopeMatch(
    FederationTarget target,
    Optional<RepoScope> repoScope
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException target이 null인 경우
     */
    public ScopeMatch {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        repoScope = repoScope == null ? Optional.empty() : repoScope;
    }

    /**
     * 저장소 제한 없는 항목 생성.
     *
     * @param target JPD
     * @return ScopeMatch 인스턴스
     */
    public static ScopeMatch unrestricted(FederationTarget target) {
        return new ScopeMatch(target, Optional.empty());
    }

    /**
     * 저장소 범위가 있는 항목 생성.
     *
     * @param target JPD
     * @param scope 저장소 범위
     * @return ScopeMatch 인스턴스
     */
    public static ScopeMatch of(FederationTarget target, RepoScope scope) {
        return new ScopeMatch(target, Optional.of(scope));
    }

    /**
     * 로그용 설명 문자열.
     *
     * @return "JPD url, repo: name" 또는 "JPD url (all repos)"
     */
    public String describe() {
        return "JPD " + target.url() + repoScope.map(s -> ", repo: " + s.repoName()).orElse(" (all repos)");
    }
}
