/**
 * Runner Adapter Layer - UploadGate / FederatedSearcher 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.adapter.runner.DuplicateUploadGate} - 검증 → 설정 → 범위 → 검색 → 판정 오케스트레이터</li>
 *   <li>{@link com.ryuqq.uploadgate.adapter.runner.ParallelFederatedSearcher} - 고정 스레드 풀 fan-out / fan-in 검색기</li>
 * </ul>
 *
 * <h2>설정</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.adapter.runner.GateConfig} - 설정 문서 키</li>
 *   <li>{@link com.ryuqq.uploadgate.adapter.runner.SearchConfig} - 동시성, 조회당 결과 수</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DuplicateUploadGate, ParallelFederatedSearcher)
 *   ↓ implements
 * application (UploadGate, FederatedSearcher)
 *   ↓ depends on
 * core (model, config, scope, policy)
 *   ↓ depends on
 * core/spi (ConfigStore, RemoteSearch)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.uploadgate.adapter.runner;
