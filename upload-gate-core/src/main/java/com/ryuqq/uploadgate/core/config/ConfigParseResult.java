package com.ryuqq.uploadgate.core.config;

import com.ryuqq.uploadgate.core.model.FederationConfig;

import java.util.List;

/**
 * 설정 파싱 결과.
 *
 * <p>ConfigParseResult는 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Parsed}: 문서를 읽었음 (일부 항목이 제외되었을 수 있음, diagnostics 참고)</li>
 *   <li>{@link Rejected}: 문서 전체를 사용할 수 없음 (빈 문자열, JSON 오류 등)</li>
 * </ul>
 *
 * <p>Rejected인 경우에도 예외는 발생하지 않으며, {@link #configOrDefault()}는
 * 빈 설정(action = warn)을 반환합니다 (fail-open).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ConfigParseResult result = parser.parse(rawText);
 * if (result instanceof ConfigParseResult.Rejected rejected) {
 *     log.warn("Config rejected: {}", rejected.reason());
 * }
 * FederationConfig config = result.configOrDefault();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ConfigParseResult permits ConfigParseResult.Parsed, ConfigParseResult.Rejected {

    /**
     * 파싱된 설정 또는 기본 설정.
     *
     * @return Parsed면 파싱된 설정, Rejected면 {@link FederationConfig#empty()}
     */
    FederationConfig configOrDefault();

    /**
     * 파싱 성공 여부.
     *
     * @return Parsed면 true
     */
    default boolean isParsed() {
        return this instanceof Parsed;
    }

    /**
     * 파싱 성공.
     *
     * @param config 정규화된 설정
     * @param diagnostics 제외된 항목에 대한 설명 목록
     */
    record Parsed(FederationConfig config, List<String> diagnostics) implements ConfigParseResult {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException config가 null인 경우
         */
        public Parsed {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }

        @Override
        public FederationConfig configOrDefault() {
            return config;
        }
    }

    /**
     * 문서 전체 거부.
     *
     * @param reason 거부 사유
     */
    record Rejected(String reason) implements ConfigParseResult {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
         */
        public Rejected {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }

        @Override
        public FederationConfig configOrDefault() {
            return FederationConfig.empty();
        }
    }
}
