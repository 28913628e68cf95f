package com.ryuqq.uploadgate.core.model;

import java.util.List;

/**
 * 검색 대상 저장소 범위.
 *
 * <p>하나의 JPD 안에서 검색할 저장소와, 선택적으로 그 저장소 안의 경로 루트를 지정합니다.</p>
 *
 * <p><strong>경로 매칭 규칙 (경계 안전 prefix):</strong></p>
 * <ul>
 *   <li>업로드 디렉터리 {@code d}가 루트 {@code r}과 같으면 매칭</li>
 *   <li>{@code d}가 {@code r + "/"}로 시작하면 매칭 ({@code r}이 이미 "/"로 끝나면 그대로 사용)</li>
 *   <li>예: 루트 "immutable"은 "immutable/sub"과 매칭되지만 "immutable2"와는 매칭되지 않음</li>
 * </ul>
 *
 * <p>pathRoots가 비어 있으면 저장소 전체가 범위에 포함됩니다.</p>
 *
 * @param repoName 저장소 이름 (필수)
 * @param pathRoots 경로 루트 목록 (순서 보존, 빈 목록 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RepoScope(
    String repoName,
    List<String> pathRoots
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException repoName이 null이거나 빈 문자열인 경우
     */
    public RepoScope {
        if (repoName == null || repoName.isBlank()) {
            throw new IllegalArgumentException("repoName cannot be null or blank");
        }
        pathRoots = pathRoots == null ? List.of() : List.copyOf(pathRoots);
    }

    /**
     * 저장소 전체를 범위로 하는 RepoScope 생성.
     *
     * @param repoName 저장소 이름
     * @return RepoScope 인스턴스
     */
    public static RepoScope wholeRepo(String repoName) {
        return new RepoScope(repoName, List.of());
    }

    /**
     * 경로 루트가 지정된 RepoScope 생성.
     *
     * @param repoName 저장소 이름
     * @param pathRoots 경로 루트 목록
     * @return RepoScope 인스턴스
     */
    public static RepoScope of(String repoName, List<String> pathRoots) {
        return new RepoScope(repoName, pathRoots);
    }

    /**
     * 경로 제한 여부.
     *
     * @return pathRoots가 하나 이상이면 true
     */
    public boolean hasPathRoots() {
        return !pathRoots.isEmpty();
    }

    /**
     * 업로드 디렉터리가 경로 루트 중 하나에 포함되는지 확인.
     *
     * <p>pathRoots가 비어 있으면 항상 true입니다.</p>
     *
     * @param directory 업로드 디렉터리 (파일 세그먼트 제외)
     * @return 하나 이상의 루트와 매칭되면 true
     */
    public boolean covers(String directory) {
        if (!hasPathRoots()) {
            return true;
        }
        String dir = directory == null ? "" : directory;
        for (String root : pathRoots) {
            if (dir.equals(root) || dir.startsWith(root.endsWith("/") ? root : root + "/")) {
                return true;
            }
        }
        return false;
    }
}
