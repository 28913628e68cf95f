package com.ryuqq.uploadgate.core.model;

import java.util.List;

/**
 * 페더레이션에 참여하는 원격 인스턴스(JPD).
 *
 * <p>url이 식별자이며, repos 목록은 설정 순서를 그대로 유지합니다
 * (검색 순서를 결정적으로 만들기 위함).</p>
 *
 * <p><strong>repos가 비어 있는 경우:</strong> 모든 저장소에 대해 경로 제한 없이 매칭됩니다.
 * 실제 검색 시에는 업로드 요청의 저장소 키가 사용됩니다.</p>
 *
 * @param url JPD 호스트 (예: acme.jfrog.io)
 * @param repos 저장소 범위 목록 (빈 목록 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FederationTarget(
    String url,
    List<RepoScope> repos
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException url이 null이거나 빈 문자열인 경우
     */
    public FederationTarget {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        repos = repos == null ? List.of() : List.copyOf(repos);
    }

    /**
     * 저장소 제한 없는 대상 생성.
     *
     * @param url JPD 호스트
     * @return FederationTarget 인스턴스
     */
    public static FederationTarget anyRepo(String url) {
        return new FederationTarget(url, List.of());
    }

    /**
     * FederationTarget 생성.
     *
     * @param url JPD 호스트
     * @param repos 저장소 범위 목록
     * @return FederationTarget 인스턴스
     */
    public static FederationTarget of(String url, List<RepoScope> repos) {
        return new FederationTarget(url, repos);
    }

    /**
     * 모든 저장소가 범위인지 확인.
     *
     * @return repos가 비어 있으면 true
     */
    public boolean matchesAnyRepo() {
        return repos.isEmpty();
    }
}
