package com.ryuqq.uploadgate.adapter.http;

/**
 * HTTP 어댑터 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>platformBaseUrl: 설정 문서를 읽을 로컬 플랫폼 주소 (기본 http://localhost:8082)</li>
 *   <li>searchScheme: 원격 JPD 검색 스킴 (기본 https)</li>
 *   <li>token: Bearer 토큰 (빈 문자열이면 Authorization 헤더 생략)</li>
 *   <li>timeoutMs: 연결 및 요청 타임아웃 (기본 10000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param platformBaseUrl 로컬 플랫폼 주소
 * @param searchScheme 원격 검색 스킴 (http 또는 https)
 * @param token Bearer 토큰
 * @param timeoutMs 타임아웃 (밀리초, 양수여야 함)
 */
public record HttpAdapterConfig(
    String platformBaseUrl,
    String searchScheme,
    String token,
    long timeoutMs
) {

    /**
     * 기본 설정 생성자.
     */
    public HttpAdapterConfig() {
        this("http://localhost:8082", "https", "", 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HttpAdapterConfig {
        if (platformBaseUrl == null || platformBaseUrl.isBlank()) {
            throw new IllegalArgumentException("platformBaseUrl cannot be null or blank");
        }
        if (!"http".equals(searchScheme) && !"https".equals(searchScheme)) {
            throw new IllegalArgumentException("searchScheme must be http or https (current: " + searchScheme + ")");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        platformBaseUrl = platformBaseUrl.endsWith("/")
            ? platformBaseUrl.substring(0, platformBaseUrl.length() - 1)
            : platformBaseUrl;
        token = token == null ? "" : token;
    }

    /**
     * platformBaseUrl만 변경한 새 인스턴스 생성.
     */
    public HttpAdapterConfig withPlatformBaseUrl(String platformBaseUrl) {
        return new HttpAdapterConfig(platformBaseUrl, searchScheme, token, timeoutMs);
    }

    /**
     * searchScheme만 변경한 새 인스턴스 생성.
     */
    public HttpAdapterConfig withSearchScheme(String searchScheme) {
        return new HttpAdapterConfig(platformBaseUrl, searchScheme, token, timeoutMs);
    }

    /**
     * token만 변경한 새 인스턴스 생성.
     */
    public HttpAdapterConfig withToken(String token) {
        return new HttpAdapterConfig(platformBaseUrl, searchScheme, token, timeoutMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public HttpAdapterConfig withTimeoutMs(long timeoutMs) {
        return new HttpAdapterConfig(platformBaseUrl, searchScheme, token, timeoutMs);
    }

    /**
     * Authorization 헤더 사용 여부.
     *
     * @return token이 비어 있지 않으면 true
     */
    public boolean hasToken() {
        return !token.isBlank();
    }

    @Override
    public String toString() {
        return "HttpAdapterConfig{platformBaseUrl=" + platformBaseUrl + ", searchScheme=" + searchScheme
            + ", token=" + (hasToken() ? "****" : "<none>") + ", timeoutMs=" + timeoutMs + "}";
    }
}
