package com.ryuqq.uploadgate.adapter.runner;

import com.ryuqq.uploadgate.application.gate.GateResponse;
import com.ryuqq.uploadgate.application.gate.UploadGate;
import com.ryuqq.uploadgate.application.search.FederatedSearcher;
import com.ryuqq.uploadgate.application.search.SearchResult;
import com.ryuqq.uploadgate.core.config.ConfigParser;
import com.ryuqq.uploadgate.core.model.FederationConfig;
import com.ryuqq.uploadgate.core.model.ScopeMatch;
import com.ryuqq.uploadgate.core.model.UploadEvent;
import com.ryuqq.uploadgate.core.policy.Decision;
import com.ryuqq.uploadgate.core.policy.PolicyEngine;
import com.ryuqq.uploadgate.core.scope.ScopeResolver;
import com.ryuqq.uploadgate.core.spi.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 중복 업로드 게이트 구현체.
 *
 * <p>검증 → 설정 로드 → 범위 계산 → (범위 없음: 즉시 허용) → 검색 → 정책 판정 → 응답 조립
 * 순서로 실행하며, 최상위 실패 처리를 담당합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * evaluate(event)
 *   ↓
 * 1. 필수 정보 검증 실패 → STOP ("Essential data missing ...")
 * 2. configStore.getText(configKey) → parser.parseOrDefault()  (실패 시 빈 설정)
 * 3. scopeResolver.resolve() → 비어 있음 → PROCEED (원격 호출 없음)
 * 4. searcher.search(matches)
 * 5. policyEngine.decide(found, action)
 * 6. GateResponse (빈 헤더)
 * </pre>
 *
 * <p><strong>오류 처리:</strong> 2~5 단계의 예상치 못한 예외는 로그를 남기고 STOP 응답으로
 * 변환합니다. 예외를 다시 던지지 않으므로 호출자는 항상 응답 값을 받습니다.</p>
 *
 * <p><strong>설정 캐시 없음:</strong> 설정은 이벤트마다 다시 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DuplicateUploadGate implements UploadGate {

    static final String MISSING_DATA_MESSAGE = "Essential data missing in the request payload.";
    static final String OUT_OF_SCOPE_MESSAGE =
        "Artifact path is not in configured search scope for any JPD. Upload allowed.";

    private final ConfigStore configStore;
    private final FederatedSearcher searcher;
    private final GateConfig config;
    private final ConfigParser parser;
    private final ScopeResolver scopeResolver;
    private final PolicyEngine policyEngine;
    private final Logger log;

    /**
     * 생성자 (기본 설정, 기본 파서/범위 계산기/정책).
     *
     * @param configStore 설정 저장소
     * @param searcher 페더레이션 검색기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DuplicateUploadGate(ConfigStore configStore, FederatedSearcher searcher) {
        this(configStore, searcher, new GateConfig());
    }

    /**
     * 생성자 (설정 지정).
     *
     * @param configStore 설정 저장소
     * @param searcher 페더레이션 검색기
     * @param config 게이트 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DuplicateUploadGate(ConfigStore configStore, FederatedSearcher searcher, GateConfig config) {
        this(configStore, searcher, config, new ConfigParser(), new ScopeResolver(), new PolicyEngine(),
            LoggerFactory.getLogger(DuplicateUploadGate.class));
    }

    /**
     * 생성자 (모든 협력자 주입).
     *
     * @param configStore 설정 저장소
     * @param searcher 페더레이션 검색기
     * @param config 게이트 설정
     * @param parser 설정 파서
     * @param scopeResolver 범위 계산기
     * @param policyEngine 정책 엔진
     * @param log 로거 (호출 컨텍스트별 주입 가능)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DuplicateUploadGate(ConfigStore configStore, FederatedSearcher searcher, GateConfig config,
                               ConfigParser parser, ScopeResolver scopeResolver, PolicyEngine policyEngine,
                               Logger log) {
        if (configStore == null) {
            throw new IllegalArgumentException("configStore cannot be null");
        }
        if (searcher == null) {
            throw new IllegalArgumentException("searcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        if (scopeResolver == null) {
            throw new IllegalArgumentException("scopeResolver cannot be null");
        }
        if (policyEngine == null) {
            throw new IllegalArgumentException("policyEngine cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.configStore = configStore;
        this.searcher = searcher;
        this.config = config;
        this.parser = parser;
        this.scopeResolver = scopeResolver;
        this.policyEngine = policyEngine;
        this.log = log;
    }

    @Override
    public GateResponse evaluate(UploadEvent event) {
        long startTimeNanos = System.nanoTime();

        // 1. 필수 정보 검증
        if (event == null || !event.isProcessable()) {
            log.error("Unable to process as payload or essential metadata (repoKey, path) is missing: {}", event);
            return GateResponse.from(Decision.stop(MISSING_DATA_MESSAGE, event));
        }
        log.debug("Attempting to upload {}", event);

        Decision decision;
        try {
            decision = decide(event);
        } catch (Exception e) {
            log.error("Gate evaluation failed for {}", event, e);
            decision = Decision.stop("Worker execution failed: " + describe(e), event);
        }

        log.debug("Gate ran for {}ms: {}", (System.nanoTime() - startTimeNanos) / 1_000_000L, decision.status());
        return GateResponse.from(decision);
    }

    /**
     * 설정 로드 → 범위 계산 → 검색 → 판정.
     *
     * @param event 검증된 업로드 이벤트
     * @return 게이트 판정
     */
    private Decision decide(UploadEvent event) {
        // 2. 설정 로드 (이벤트마다 새로 읽음)
        String rawConfig = configStore.getText(config.configKey());
        FederationConfig federation = parser.parseOrDefault(rawConfig);
        log.debug("Config: {}", federation);

        // 3. 범위 계산 (비어 있으면 원격 호출 없이 허용)
        List<ScopeMatch> matches = scopeResolver.resolve(federation, event);
        if (matches.isEmpty()) {
            log.debug("No relevant JPDs for path \"{}\". Allowing upload.", event.directory());
            return Decision.proceed(OUT_OF_SCOPE_MESSAGE, event);
        }

        // 4. 병렬 검색
        SearchResult result = searcher.search(matches, event);
        if (result.found()) {
            log.info("Duplicate found for {}. Applying action '{}'.", event, federation.action());
        }

        // 5. 정책 판정
        return policyEngine.decide(result.found(), federation.action(), result.firstMatch(), event);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : "Unknown error";
    }
}
