package com.ryuqq.uploadgate.core.scope;

import com.ryuqq.uploadgate.core.model.FederationConfig;
import com.ryuqq.uploadgate.core.model.FederationTarget;
import com.ryuqq.uploadgate.core.model.RepoScope;
import com.ryuqq.uploadgate.core.model.ScopeMatch;
import com.ryuqq.uploadgate.core.model.UploadEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * 검색 범위 계산기.
 *
 * <p>업로드 이벤트와 설정으로부터 검색해야 할 (JPD, 저장소 범위) 목록을 계산합니다.</p>
 *
 * <p><strong>알고리즘 (설정 순서대로):</strong></p>
 * <ol>
 *   <li>대상에 repos가 없으면 (target, 없음) 추가</li>
 *   <li>repos의 각 범위에 대해:
 *       <ul>
 *         <li>pathRoots가 있으면 업로드 디렉터리가 루트 중 하나와 매칭될 때만 추가</li>
 *         <li>pathRoots가 없으면 무조건 추가 (저장소 전체)</li>
 *       </ul>
 *   </li>
 * </ol>
 *
 * <p>대상 간 중복 제거는 하지 않습니다. 결과가 비어 있으면 업로드는 어떤 검색 범위에도
 * 속하지 않으며, 원격 호출 없이 허용됩니다.</p>
 *
 * <p><strong>멱등성:</strong> 같은 (config, event)에 대해 항상 같은 순서의 결과를 반환합니다.
 * 상태가 없으므로 thread-safe합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScopeResolver {

    /**
     * 검색 범위 계산.
     *
     * @param config 페더레이션 설정
     * @param event 업로드 이벤트
     * @return 검색 대상 목록 (설정 순서, 빈 목록 가능)
     * @throws IllegalArgumentException config 또는 event가 null인 경우
     */
    public List<ScopeMatch> resolve(FederationConfig config, UploadEvent event) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        String uploadDir = event.directory();
        List<ScopeMatch> matches = new ArrayList<>();

        for (FederationTarget target : config.targets()) {
            if (target.matchesAnyRepo()) {
                matches.add(ScopeMatch.unrestricted(target));
                continue;
            }
            for (RepoScope scope : target.repos()) {
                if (scope.covers(uploadDir)) {
                    matches.add(ScopeMatch.of(target, scope));
                }
            }
        }
        return List.copyOf(matches);
    }
}
