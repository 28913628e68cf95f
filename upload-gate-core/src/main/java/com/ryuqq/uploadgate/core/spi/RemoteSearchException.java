package com.ryuqq.uploadgate.core.spi;

/**
 * 원격 검색 실패 예외.
 *
 * <p>네트워크 오류, 비정상 HTTP 상태, 응답 형식 오류 등 원격 호출 실패를 나타냅니다.
 * 검색기는 이 예외를 해당 범위의 "발견 없음"으로 처리합니다 (fail-open).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RemoteSearchException extends RuntimeException {

    private final String targetUrl;

    /**
     * 생성자.
     *
     * @param targetUrl 실패한 JPD
     * @param message 오류 메시지
     */
    public RemoteSearchException(String targetUrl, String message) {
        super(message);
        this.targetUrl = targetUrl;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param targetUrl 실패한 JPD
     * @param message 오류 메시지
     * @param cause 원인
     */
    public RemoteSearchException(String targetUrl, String message, Throwable cause) {
        super(message, cause);
        this.targetUrl = targetUrl;
    }

    /**
     * 실패한 JPD 조회.
     *
     * @return JPD 호스트
     */
    public String getTargetUrl() {
        return targetUrl;
    }
}
