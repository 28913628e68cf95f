package com.ryuqq.uploadgate.adapter.http;

import com.ryuqq.uploadgate.core.spi.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * 로컬 플랫폼 저장소에서 설정 문서를 읽는 ConfigStore.
 *
 * <p>{@code GET {platformBaseUrl}/artifactory/{key}} 요청으로 설정 문서를 읽습니다
 * (워커는 파일 시스템에 접근할 수 없으므로 저장소에 설정을 둡니다).</p>
 *
 * <p><strong>실패 처리 (fail-open):</strong></p>
 * <ul>
 *   <li>200이 아닌 응답: 빈 문자열 + 오류 로그</li>
 *   <li>네트워크 오류: 빈 문자열 + 오류 로그</li>
 *   <li>인터럽트: 인터럽트 플래그 복원 후 빈 문자열</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(HttpConfigStore.class);

    private final HttpAdapterConfig config;
    private final HttpClient httpClient;

    /**
     * 생성자 (기본 HttpClient).
     *
     * @param config HTTP 어댑터 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public HttpConfigStore(HttpAdapterConfig config) {
        this(config, config == null ? null : HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.timeoutMs()))
            .build());
    }

    /**
     * 생성자 (HttpClient 주입).
     *
     * @param config HTTP 어댑터 설정
     * @param httpClient HTTP 클라이언트
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HttpConfigStore(HttpAdapterConfig config, HttpClient httpClient) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public String getText(String key) {
        if (key == null || key.isBlank()) {
            log.warn("Config key is empty. Returning empty config.");
            return "";
        }

        String url = config.platformBaseUrl() + "/artifactory/" + key;
        log.info("Getting config from: {}", url);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofMillis(config.timeoutMs()))
            .GET();
        if (config.hasToken()) {
            builder.header("Authorization", "Bearer " + config.token());
        }

        try {
            HttpResponse<String> response = httpClient.send(builder.build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                log.error("Unable to load config: Status {}. Message: {}", response.statusCode(), response.body());
                return "";
            }
            log.debug("Config loaded successfully from {}", url);
            return response.body() == null ? "" : response.body();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error loading config from {}: {}", url, e.getMessage());
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while loading config from {}", url);
            return "";
        }
    }
}
