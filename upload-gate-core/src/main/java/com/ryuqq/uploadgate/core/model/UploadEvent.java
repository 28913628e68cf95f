package com.ryuqq.uploadgate.core.model;

/**
 * 업로드 요청 식별 정보.
 *
 * <p>저장소 키와 저장소 내 경로(슬래시 구분, 마지막 세그먼트가 파일)로 구성됩니다.
 * 두 값 모두 비어 있지 않아야 처리 가능합니다. 검증은 생성 시점이 아니라
 * {@link #isProcessable()}로 수행합니다 (게이트가 STOP 응답으로 변환해야 하므로).</p>
 *
 * @param repoKey 저장소 키 (null 허용, 처리 불가 상태)
 * @param path 저장소 내 경로 (null 허용, 처리 불가 상태)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record UploadEvent(
    String repoKey,
    String path
) {

    /**
     * UploadEvent 생성.
     *
     * @param repoKey 저장소 키
     * @param path 저장소 내 경로
     * @return UploadEvent 인스턴스
     */
    public static UploadEvent of(String repoKey, String path) {
        return new UploadEvent(repoKey, path);
    }

    /**
     * 필수 식별 정보가 모두 있는지 확인.
     *
     * @return repoKey와 path가 모두 비어 있지 않으면 true
     */
    public boolean isProcessable() {
        return repoKey != null && !repoKey.isBlank()
            && path != null && !path.isBlank();
    }

    /**
     * 파일 세그먼트를 제외한 디렉터리 경로.
     *
     * @return 디렉터리 경로 (파일만 있는 경우 빈 문자열)
     */
    public String directory() {
        if (path == null) {
            return "";
        }
        int idx = path.lastIndexOf('/');
        return idx < 0 ? "" : path.substring(0, idx);
    }

    /**
     * 마지막 세그먼트 (파일 이름).
     *
     * @return 파일 이름 (경로가 "/"로 끝나면 빈 문자열)
     */
    public String fileName() {
        if (path == null) {
            return "";
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    @Override
    public String toString() {
        return repoKey + "/" + path;
    }
}
