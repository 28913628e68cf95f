package com.ryuqq.uploadgate.core.model;

/**
 * 원격 검색에서 발견된 항목.
 *
 * @param targetUrl 항목이 발견된 JPD
 * @param repo 저장소 이름
 * @param path 디렉터리 경로 (루트는 ".")
 * @param name 파일 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FoundItem(
    String targetUrl,
    String repo,
    String path,
    String name
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException targetUrl이 null이거나 빈 문자열인 경우
     */
    public FoundItem {
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new IllegalArgumentException("targetUrl cannot be null or blank");
        }
    }

    /**
     * 저장소 내 전체 경로 (디렉터리 + 파일 이름).
     *
     * @return 루트(".") 항목이면 파일 이름만, 아니면 "path/name"
     */
    public String fullPath() {
        if (path == null || path.isEmpty() || ".".equals(path)) {
            return name;
        }
        return path + "/" + name;
    }

    /**
     * 위치 설명 문자열.
     *
     * @return "targetUrl:repo/fullPath"
     */
    public String location() {
        return targetUrl + ":" + repo + "/" + fullPath();
    }
}
