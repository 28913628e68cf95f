package com.ryuqq.uploadgate.adapter.runner;

/**
 * ParallelFederatedSearcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 원격 조회 스레드 수 (기본 8)</li>
 *   <li>resultLimit: 조회당 최대 결과 수 (기본 1, 존재 여부만 확인)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 동시 조회 스레드 수 (1 이상이어야 함)
 * @param resultLimit 조회당 최대 결과 수 (1 이상이어야 함)
 */
public record SearchConfig(
    int concurrency,
    int resultLimit
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=8, resultLimit=1</p>
     */
    public SearchConfig() {
        this(8, 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SearchConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (resultLimit <= 0) {
            throw new IllegalArgumentException(
                "resultLimit must be positive (current: " + resultLimit + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public SearchConfig withConcurrency(int concurrency) {
        return new SearchConfig(concurrency, resultLimit);
    }

    /**
     * resultLimit만 변경한 새 인스턴스 생성.
     */
    public SearchConfig withResultLimit(int resultLimit) {
        return new SearchConfig(concurrency, resultLimit);
    }
}
