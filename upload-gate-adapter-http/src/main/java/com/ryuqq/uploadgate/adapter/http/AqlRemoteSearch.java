package com.ryuqq.uploadgate.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.uploadgate.core.model.ExistenceQuery;
import com.ryuqq.uploadgate.core.model.FoundItem;
import com.ryuqq.uploadgate.core.spi.RemoteSearch;
import com.ryuqq.uploadgate.core.spi.RemoteSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * AQL 기반 원격 검색 클라이언트.
 *
 * <p>ExistenceQuery를 AQL로 변환하여 대상 JPD의 검색 API에 POST합니다.</p>
 *
 * <p><strong>요청:</strong></p>
 * <pre>
 * POST {scheme}://{target}/artifactory/api/search/aql
 * Content-Type: text/plain
 * Authorization: Bearer {token}
 *
 * items.find({...}).include("repo","path","name").limit(1)
 * </pre>
 *
 * <p><strong>응답:</strong> {@code {"results":[{"repo":..,"path":..,"name":..}]}}</p>
 *
 * <p>2xx가 아닌 응답, 네트워크 오류, 응답 형식 오류는 모두
 * {@link RemoteSearchException}으로 전달합니다. 재시도는 하지 않습니다.</p>
 *
 * <p>HttpClient는 thread-safe하므로 여러 검색 스레드가 공유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AqlRemoteSearch implements RemoteSearch {

    private static final Logger log = LoggerFactory.getLogger(AqlRemoteSearch.class);

    private final HttpAdapterConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AqlQueryBuilder queryBuilder;

    /**
     * 생성자 (기본 HttpClient, ObjectMapper).
     *
     * @param config HTTP 어댑터 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public AqlRemoteSearch(HttpAdapterConfig config) {
        this(config, newHttpClient(config), new ObjectMapper());
    }

    /**
     * 생성자 (HttpClient, ObjectMapper 주입).
     *
     * @param config HTTP 어댑터 설정
     * @param httpClient HTTP 클라이언트
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AqlRemoteSearch(HttpAdapterConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.queryBuilder = new AqlQueryBuilder(objectMapper);
    }

    @Override
    public List<FoundItem> find(String targetUrl, ExistenceQuery query) {
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new IllegalArgumentException("targetUrl cannot be null or blank");
        }
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }

        String aql = queryBuilder.build(query);
        log.debug("Running AQL on JPD {}: {}", targetUrl, aql);

        HttpResponse<String> response = send(targetUrl, aql);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.error("AQL query on JPD {} failed with status {}: {}", targetUrl, response.statusCode(), response.body());
            throw new RemoteSearchException(targetUrl,
                "AQL query on JPD " + targetUrl + " failed with status " + response.statusCode());
        }

        List<FoundItem> items = parseResults(targetUrl, response.body());
        log.debug("JPD {}: Found {} item(s) for query {}", targetUrl, items.size(), aql);
        return items;
    }

    private HttpResponse<String> send(String targetUrl, String aql) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(config.searchScheme() + "://" + targetUrl + "/artifactory/api/search/aql"))
            .timeout(Duration.ofMillis(config.timeoutMs()))
            .header("Content-Type", "text/plain")
            .POST(HttpRequest.BodyPublishers.ofString(aql, StandardCharsets.UTF_8));
        if (config.hasToken()) {
            builder.header("Authorization", "Bearer " + config.token());
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("AQL query on JPD {} failed: {}", targetUrl, e.getMessage());
            throw new RemoteSearchException(targetUrl, "AQL query on JPD " + targetUrl + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteSearchException(targetUrl, "AQL query on JPD " + targetUrl + " interrupted", e);
        }
    }

    private List<FoundItem> parseResults(String targetUrl, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteSearchException(targetUrl, "Malformed AQL response from JPD " + targetUrl, e);
        }

        List<FoundItem> items = new ArrayList<>();
        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) {
            return items;
        }
        for (JsonNode result : results) {
            items.add(new FoundItem(
                targetUrl,
                result.path("repo").asText(""),
                result.path("path").asText(ExistenceQuery.ROOT_PATH),
                result.path("name").asText("")
            ));
        }
        return items;
    }

    private static HttpClient newHttpClient(HttpAdapterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.timeoutMs()))
            .build();
    }
}
