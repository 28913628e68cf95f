package com.ryuqq.uploadgate.adapter.runner;

import com.ryuqq.uploadgate.application.search.FederatedSearcher;
import com.ryuqq.uploadgate.application.search.SearchResult;
import com.ryuqq.uploadgate.core.model.ExistenceQuery;
import com.ryuqq.uploadgate.core.model.FoundItem;
import com.ryuqq.uploadgate.core.model.ScopeMatch;
import com.ryuqq.uploadgate.core.model.UploadEvent;
import com.ryuqq.uploadgate.core.spi.RemoteSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 스레드 풀 기반 페더레이션 검색기.
 *
 * <p>범위 항목마다 하나의 작업을 고정 크기 스레드 풀에 제출하고,
 * 모든 작업이 끝날 때까지 대기한 뒤 결과를 집계합니다 (fan-out / fan-in).</p>
 *
 * <p><strong>작업 흐름 (범위 항목마다):</strong></p>
 * <pre>
 * 1. 이미 발견됨? → 원격 호출 없이 skip
 * 2. ExistenceQuery 생성 (저장소 / 경로 / 파일 이름, limit)
 * 3. remoteSearch.find(targetUrl, query)
 * 4. 결과 있음 → compareAndSet(null, 첫 항목)  (first write wins)
 * 5. 예외 → 로그 + 실패 카운트, 해당 범위는 "발견 없음"
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>발견 항목 슬롯은 호출마다 새로 만든 AtomicReference이며, compareAndSet으로만 기록</li>
 *   <li>"확인 후 기록" 사이의 간격으로 인해 원격 호출이 한 번 더 발생할 수 있으나 결과에는 영향 없음</li>
 *   <li>진행 중인 원격 호출은 취소하지 않음 (skip은 호출 전에만 적용)</li>
 *   <li>기록되는 항목은 완료 순서에 따라 결정되며, 동시 발견 시 어느 항목인지는 보장하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ParallelFederatedSearcher implements FederatedSearcher {

    private static final Logger log = LoggerFactory.getLogger(ParallelFederatedSearcher.class);

    private final RemoteSearch remoteSearch;
    private final SearchConfig config;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param remoteSearch 원격 검색 클라이언트
     * @throws IllegalArgumentException remoteSearch가 null인 경우
     */
    public ParallelFederatedSearcher(RemoteSearch remoteSearch) {
        this(remoteSearch, new SearchConfig());
    }

    /**
     * 생성자.
     *
     * @param remoteSearch 원격 검색 클라이언트
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ParallelFederatedSearcher(RemoteSearch remoteSearch, SearchConfig config) {
        if (remoteSearch == null) {
            throw new IllegalArgumentException("remoteSearch cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.remoteSearch = remoteSearch;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public SearchResult search(List<ScopeMatch> matches, UploadEvent event) {
        if (matches == null) {
            throw new IllegalArgumentException("matches cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (matches.isEmpty()) {
            return SearchResult.none();
        }

        SearchRun run = new SearchRun(event);

        // 1. 범위 항목마다 작업 제출
        CompletableFuture<?>[] tasks = matches.stream()
            .map(match -> CompletableFuture.runAsync(() -> searchScope(match, run), workerExecutor))
            .toArray(CompletableFuture[]::new);

        // 2. 모든 작업 완료 대기 (wait-for-all)
        CompletableFuture.allOf(tasks).join();
        log.debug("All JPD searches completed for {}: searched={}, skipped={}, failed={}",
            event, run.searched.get(), run.skipped.get(), run.failed.get());

        return new SearchResult(
            Optional.ofNullable(run.firstMatch.get()),
            run.searched.get(),
            run.skipped.get(),
            run.failed.get()
        );
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>진행 중인 검색이 완료되도록 graceful shutdown합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    /**
     * 범위 항목 하나 검색.
     *
     * <p>예외는 여기서 처리하며, 다른 작업이나 전체 검색에 전파하지 않습니다.</p>
     *
     * @param match 범위 항목
     * @param run 현재 검색 상태
     */
    private void searchScope(ScopeMatch match, SearchRun run) {
        if (run.firstMatch.get() != null) {
            run.skipped.incrementAndGet();
            log.debug("Skipping search for {} because duplicate already found.", match.describe());
            return;
        }

        log.debug("Starting search for {}", match.describe());
        try {
            ExistenceQuery query = ExistenceQuery.forScope(match, run.event, config.resultLimit());
            run.searched.incrementAndGet();
            List<FoundItem> items = remoteSearch.find(match.target().url(), query);
            log.debug("Finished search for {}: {} item(s)", match.describe(), items == null ? 0 : items.size());

            if (items != null && !items.isEmpty() && run.firstMatch.compareAndSet(null, items.get(0))) {
                log.info("Duplicate found in {} - short-circuiting.", match.describe());
            }
        } catch (Exception e) {
            run.failed.incrementAndGet();
            log.error("Error in search for {}: {}", match.describe(), e.getMessage(), e);
        }
    }

    /**
     * 검색 호출 하나의 상태 (호출 간 공유 없음).
     */
    private static final class SearchRun {

        private final UploadEvent event;
        private final AtomicReference<FoundItem> firstMatch = new AtomicReference<>();
        private final AtomicInteger searched = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();

        private SearchRun(UploadEvent event) {
            this.event = event;
        }
    }
}
