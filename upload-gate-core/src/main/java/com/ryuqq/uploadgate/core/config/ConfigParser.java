package com.ryuqq.uploadgate.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.uploadgate.core.model.FederationConfig;
import com.ryuqq.uploadgate.core.model.FederationTarget;
import com.ryuqq.uploadgate.core.model.RepoScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 페더레이션 설정 문서 파서.
 *
 * <p>설정 문서(JSON)를 정규화된 {@link FederationConfig}로 변환합니다.
 * 잘못된 입력에 대해 예외를 던지지 않으며, 잘못된 하위 항목은 제외하고
 * diagnostics 목록에 기록합니다.</p>
 *
 * <p><strong>문서 형태:</strong></p>
 * <pre>
 * {
 *   "jpds": [
 *     { "url": "acme.jfrog.io", "repos": [ "libs-release", { "name": "docker", "paths": ["immutable"] } ] }
 *   ],
 *   "action": "block"
 * }
 * </pre>
 *
 * <p><strong>정규화 규칙:</strong></p>
 * <ul>
 *   <li>빈 문자열 또는 JSON 오류: Rejected (기본 설정: 대상 없음, action = warn)</li>
 *   <li>url이 없거나 빈 대상: 제외</li>
 *   <li>repos가 없거나 배열이 아닌 대상: 모든 저장소 대상</li>
 *   <li>저장소 항목: 문자열이면 이름, 객체면 name + paths, 이름 없으면 제외</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConfigParser {

    private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

    private final ObjectMapper objectMapper;

    /**
     * 기본 ObjectMapper를 사용하는 생성자.
     */
    public ConfigParser() {
        this(new ObjectMapper());
    }

    /**
     * 생성자 (ObjectMapper 주입).
     *
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public ConfigParser(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 설정 문서 파싱.
     *
     * @param rawText 설정 문서 원문 (null 허용)
     * @return Parsed 또는 Rejected (예외 없음)
     */
    public ConfigParseResult parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            log.warn("Config string is empty. Initializing with default empty config.");
            return new ConfigParseResult.Rejected("Config string is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawText);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse config JSON: {}. Raw string: {}", e.getOriginalMessage(), rawText);
            return new ConfigParseResult.Rejected("Malformed config JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            log.error("Config root is not a JSON object. Raw string: {}", rawText);
            return new ConfigParseResult.Rejected("Config root is not a JSON object");
        }

        List<String> diagnostics = new ArrayList<>();
        List<FederationTarget> targets = parseTargets(root.get("jpds"), diagnostics);
        JsonNode actionNode = root.get("action");
        String action = actionNode != null && actionNode.isTextual() ? actionNode.asText() : null;
        if (action == null) {
            diagnostics.add("action is missing or not a string");
        }

        diagnostics.forEach(d -> log.warn("Config entry ignored: {}", d));
        return new ConfigParseResult.Parsed(new FederationConfig(targets, action), diagnostics);
    }

    /**
     * 설정 문서 파싱 (실패 시 기본 설정).
     *
     * @param rawText 설정 문서 원문 (null 허용)
     * @return 정규화된 설정 (실패 시 {@link FederationConfig#empty()})
     */
    public FederationConfig parseOrDefault(String rawText) {
        return parse(rawText).configOrDefault();
    }

    private List<FederationTarget> parseTargets(JsonNode jpds, List<String> diagnostics) {
        List<FederationTarget> targets = new ArrayList<>();
        if (jpds == null || !jpds.isArray()) {
            diagnostics.add("jpds is missing or not an array");
            return targets;
        }
        for (int i = 0; i < jpds.size(); i++) {
            JsonNode jpd = jpds.get(i);
            JsonNode url = jpd.get("url");
            if (!jpd.isObject() || url == null || !url.isTextual() || url.asText().isBlank()) {
                diagnostics.add("jpds[" + i + "] has no url");
                continue;
            }
            targets.add(new FederationTarget(url.asText(), parseRepos(jpd.get("repos"), i, diagnostics)));
        }
        return targets;
    }

    private List<RepoScope> parseRepos(JsonNode repos, int jpdIndex, List<String> diagnostics) {
        List<RepoScope> scopes = new ArrayList<>();
        if (repos == null || !repos.isArray()) {
            return scopes;
        }
        for (int i = 0; i < repos.size(); i++) {
            JsonNode repo = repos.get(i);
            String where = "jpds[" + jpdIndex + "].repos[" + i + "]";
            if (repo.isTextual() && !repo.asText().isBlank()) {
                scopes.add(RepoScope.wholeRepo(repo.asText()));
            } else if (repo.isObject() && repo.path("name").isTextual() && !repo.path("name").asText().isBlank()) {
                scopes.add(RepoScope.of(repo.get("name").asText(), parsePaths(repo.get("paths"), where, diagnostics)));
            } else {
                diagnostics.add(where + " has no name");
            }
        }
        return scopes;
    }

    private List<String> parsePaths(JsonNode paths, String where, List<String> diagnostics) {
        List<String> roots = new ArrayList<>();
        if (paths == null || paths.isNull()) {
            return roots;
        }
        if (!paths.isArray()) {
            diagnostics.add(where + ".paths is not an array");
            return roots;
        }
        for (JsonNode path : paths) {
            if (path.isTextual() && !path.asText().isBlank()) {
                roots.add(path.asText());
            } else {
                diagnostics.add(where + ".paths contains a non-string entry");
            }
        }
        return roots;
    }
}
