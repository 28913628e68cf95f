package com.ryuqq.uploadgate.testkit.contract;

import com.ryuqq.uploadgate.adapter.runner.SearchConfig;
import com.ryuqq.uploadgate.application.gate.GateResponse;
import com.ryuqq.uploadgate.core.policy.GateStatus;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: first-match short-circuit.
 *
 * <p>Uses a single search thread so that scopes run one after another and
 * the pre-call guard becomes observable.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ShortCircuitContractTest extends AbstractGateContractTest {

    private static final String THREE_TARGETS = "{\"jpds\":["
            + "{\"url\":\"a\",\"repos\":[\"r\"]},"
            + "{\"url\":\"b\",\"repos\":[\"r\"]},"
            + "{\"url\":\"c\",\"repos\":[\"r\"]}"
            + "],\"action\":\"block\"}";

    @Override
    protected SearchConfig searchConfig() {
        return new SearchConfig().withConcurrency(1);
    }

    @Test
    void testFirstScopeMatches_LaterScopesSkipped() {
        // Given
        givenConfig(THREE_TARGETS);
        remoteSearch.store("a", "r", "dir", "file.txt");

        // When
        GateResponse response = evaluate("r", "dir/file.txt");

        // Then
        assertStatus(response, GateStatus.STOP);
        assertEquals(1, remoteSearch.calls().size(), "Scopes after the match should not be searched");
        assertEquals("a", remoteSearch.calls().get(0).targetUrl());
    }

    @Test
    void testLastScopeMatches_AllScopesSearched() {
        // Given
        givenConfig(THREE_TARGETS);
        remoteSearch.store("c", "r", "dir", "file.txt");

        // When
        GateResponse response = evaluate("r", "dir/file.txt");

        // Then
        assertStatus(response, GateStatus.STOP);
        assertEquals(3, remoteSearch.calls().size());
        assertTrue(response.message().contains("c:r/dir/file.txt"));
    }

    @RepeatedTest(5)
    void testAnyMatch_NeverProceeds() {
        // Given: every target holds the artifact
        givenConfig(THREE_TARGETS);
        remoteSearch.store("a", "r", "dir", "file.txt");
        remoteSearch.store("b", "r", "dir", "file.txt");
        remoteSearch.store("c", "r", "dir", "file.txt");

        // When
        GateResponse response = evaluate("r", "dir/file.txt");

        // Then
        assertNotEquals(GateStatus.PROCEED, response.status());
    }
}
