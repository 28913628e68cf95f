package com.ryuqq.uploadgate.application.search;

import com.ryuqq.uploadgate.core.model.FoundItem;

import java.util.Optional;

/**
 * 페더레이션 검색 결과.
 *
 * @param firstMatch 처음 기록된 발견 항목 (없으면 Optional.empty())
 * @param searched 원격 호출을 수행한 범위 수
 * @param skipped 이미 발견되어 건너뛴 범위 수
 * @param failed 원격 호출이 실패한 범위 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SearchResult(
    Optional<FoundItem> firstMatch,
    int searched,
    int skipped,
    int failed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 카운터가 음수인 경우
     */
    public SearchResult {
        firstMatch = firstMatch == null ? Optional.empty() : firstMatch;
        if (searched < 0 || skipped < 0 || failed < 0) {
            throw new IllegalArgumentException("counters cannot be negative");
        }
    }

    /**
     * 검색 대상이 없었던 결과.
     *
     * @return 발견 없음, 카운터 0
     */
    public static SearchResult none() {
        return new SearchResult(Optional.empty(), 0, 0, 0);
    }

    /**
     * 중복 발견 여부.
     *
     * @return 발견 항목이 기록되었으면 true
     */
    public boolean found() {
        return firstMatch.isPresent();
    }
}
