package com.ryuqq.uploadgate.adapter.runner;

/**
 * DuplicateUploadGate 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param configKey 설정 문서 키 (ConfigStore 조회용)
 */
public record GateConfig(String configKey) {

    /** 기본 설정 문서 키. */
    public static final String DEFAULT_CONFIG_KEY = "worker-config/blocker-config.json";

    /**
     * 기본 설정 생성자.
     */
    public GateConfig() {
        this(DEFAULT_CONFIG_KEY);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException configKey가 null이거나 빈 문자열인 경우
     */
    public GateConfig {
        if (configKey == null || configKey.isBlank()) {
            throw new IllegalArgumentException("configKey cannot be null or blank");
        }
    }

    /**
     * configKey만 변경한 새 인스턴스 생성.
     */
    public GateConfig withConfigKey(String configKey) {
        return new GateConfig(configKey);
    }
}
