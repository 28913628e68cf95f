package com.ryuqq.uploadgate.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.uploadgate.core.model.ExistenceQuery;

import java.util.List;

/**
 * ExistenceQuery를 AQL(items.find) 질의로 변환합니다.
 *
 * <p><strong>생성 형태:</strong></p>
 * <pre>
 * items.find({"$and":[ repo조건, path조건, name조건 ]}).include("repo","path","name").limit(n)
 * </pre>
 *
 * <p><strong>조건 규칙:</strong></p>
 * <ul>
 *   <li>repo: 하나면 {"repo":r}, 여러 개면 {"$or":[{"repo":r1},...]}, 없으면 생략</li>
 *   <li>path: prefix 하나면 {"path":{"$match":"p*"}}, 여러 개면 $or, 없으면 {"path":exactPath}</li>
 *   <li>name: {"name":{"$match":fileName}}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AqlQueryBuilder {

    private final ObjectMapper objectMapper;

    /**
     * 생성자.
     *
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public AqlQueryBuilder(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * AQL 질의 문자열 생성.
     *
     * @param query 존재 여부 필터
     * @return AQL 질의
     * @throws IllegalArgumentException query가 null인 경우
     */
    public String build(ExistenceQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        return "items.find(" + findClause(query) + ")"
            + ".include(\"repo\",\"path\",\"name\")"
            + ".limit(" + query.limit() + ")";
    }

    /**
     * find 절(JSON) 생성.
     *
     * @param query 존재 여부 필터
     * @return {"$and":[...]} JSON 문자열
     */
    String findClause(ExistenceQuery query) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode criteria = root.putArray("$and");

        // 1. 저장소 조건
        List<String> repos = query.repos();
        if (repos.size() == 1) {
            criteria.addObject().put("repo", repos.get(0));
        } else if (repos.size() > 1) {
            ArrayNode or = criteria.addObject().putArray("$or");
            repos.forEach(repo -> or.addObject().put("repo", repo));
        }

        // 2. 경로 조건
        List<String> prefixes = query.pathPrefixes();
        if (prefixes.size() == 1) {
            criteria.add(pathMatch(prefixes.get(0)));
        } else if (prefixes.size() > 1) {
            ArrayNode or = criteria.addObject().putArray("$or");
            prefixes.forEach(prefix -> or.add(pathMatch(prefix)));
        } else {
            criteria.addObject().put("path", query.exactPath());
        }

        // 3. 파일 이름 조건
        criteria.addObject().putObject("name").put("$match", query.fileName());

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render AQL criteria", e);
        }
    }

    private ObjectNode pathMatch(String prefix) {
        ObjectNode node = objectMapper.createObjectNode();
        node.putObject("path").put("$match", prefix + "*");
        return node;
    }
}
