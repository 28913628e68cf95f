package com.ryuqq.uploadgate.core.model;

import java.util.List;

/**
 * 원격 존재 여부 조회 필터.
 *
 * <p>원격 검색 구현체에 전달되는 구조화된 필터입니다. 실제 질의 언어로의 변환은
 * 어댑터의 책임입니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>repos:</strong> 저장소 필터 (하나면 단일 조건, 여러 개면 OR, 비어 있으면 제한 없음)</li>
 *   <li><strong>pathPrefixes:</strong> 경로 prefix 필터 (하나면 단일, 여러 개면 OR)</li>
 *   <li><strong>exactPath:</strong> pathPrefixes가 비어 있을 때 사용하는 정확한 디렉터리 (루트는 ".")</li>
 *   <li><strong>fileName:</strong> 파일 이름 매칭 패턴 (없으면 "*")</li>
 *   <li><strong>limit:</strong> 최대 결과 수 (1 이상)</li>
 * </ul>
 *
 * @param repos 저장소 목록
 * @param pathPrefixes 경로 prefix 목록
 * @param exactPath 정확한 디렉터리 경로
 * @param fileName 파일 이름 패턴
 * @param limit 최대 결과 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExistenceQuery(
    List<String> repos,
    List<String> pathPrefixes,
    String exactPath,
    String fileName,
    int limit
) {

    /** 루트 디렉터리 표기. */
    public static final String ROOT_PATH = ".";

    /** 파일 이름이 비어 있을 때 사용하는 와일드카드. */
    public static final String ANY_NAME = "*";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException limit이 양수가 아닌 경우
     */
    public ExistenceQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        repos = repos == null ? List.of() : List.copyOf(repos);
        pathPrefixes = pathPrefixes == null ? List.of() : List.copyOf(pathPrefixes);
        exactPath = exactPath == null || exactPath.isEmpty() ? ROOT_PATH : exactPath;
        fileName = fileName == null || fileName.isEmpty() ? ANY_NAME : fileName;
    }

    /**
     * ScopeMatch와 업로드 이벤트로부터 필터 생성.
     *
     * <p><strong>규칙:</strong></p>
     * <ol>
     *   <li>저장소: 범위의 저장소 이름, 범위가 없으면 업로드 저장소 키</li>
     *   <li>경로: 범위의 pathRoots (prefix OR), 없으면 업로드 디렉터리</li>
     *   <li>이름: 업로드 파일 이름</li>
     * </ol>
     *
     * @param match 범위 항목
     * @param event 업로드 이벤트
     * @param limit 최대 결과 수
     * @return ExistenceQuery 인스턴스
     */
    public static ExistenceQuery forScope(ScopeMatch match, UploadEvent event, int limit) {
        String repo = match.repoScope().map(RepoScope::repoName).orElse(event.repoKey());
        List<String> prefixes = match.repoScope().map(RepoScope::pathRoots).orElse(List.of());
        return new ExistenceQuery(List.of(repo), prefixes, event.directory(), event.fileName(), limit);
    }

    /**
     * 경로 prefix 검색 여부.
     *
     * @return pathPrefixes가 하나 이상이면 true
     */
    public boolean usesPathPrefixes() {
        return !pathPrefixes.isEmpty();
    }
}
