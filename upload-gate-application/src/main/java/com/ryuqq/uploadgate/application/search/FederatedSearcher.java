package com.ryuqq.uploadgate.application.search;

import com.ryuqq.uploadgate.core.model.ScopeMatch;
import com.ryuqq.uploadgate.core.model.UploadEvent;

import java.util.List;

/**
 * 페더레이션 중복 검색기.
 *
 * <p>범위 항목마다 하나의 존재 여부 조회를 병렬로 수행하고, 처음 기록된 발견 항목을 반환합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>이미 발견된 경우 아직 시작하지 않은 조회는 원격 호출 없이 건너뜀</li>
 *   <li>시작된 조회는 취소하지 않으며, 모든 조회가 끝날 때까지 대기</li>
 *   <li>개별 조회 실패는 해당 범위의 "발견 없음"으로 처리 (전체 검색은 실패하지 않음)</li>
 *   <li>처음 기록된 발견 항목만 유지 (first write wins)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FederatedSearcher {

    /**
     * 범위 항목 검색.
     *
     * @param matches 검색 범위 목록
     * @param event 업로드 이벤트
     * @return 검색 결과
     * @throws IllegalArgumentException matches 또는 event가 null인 경우
     */
    SearchResult search(List<ScopeMatch> matches, UploadEvent event);
}
