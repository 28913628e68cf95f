package com.ryuqq.uploadgate.testkit.contract;

import com.ryuqq.uploadgate.application.gate.GateResponse;
import com.ryuqq.uploadgate.core.policy.GateStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: configured action applied to search findings.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>block + duplicate → STOP naming target, repository and found path</li>
 *   <li>warn + duplicate → WARN</li>
 *   <li>no duplicate → PROCEED regardless of action</li>
 *   <li>unknown action + duplicate → STOP</li>
 *   <li>two targets, only the first has the artifact → message references the first</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PolicyContractTest extends AbstractGateContractTest {

    @Test
    void testBlock_DuplicateFound_Stops() {
        // Given
        givenConfig(singleTargetConfig("a", "r", "immutable", "block"));
        remoteSearch.store("a", "r", "immutable/x", "file.txt");

        // When
        GateResponse response = evaluate("r", "immutable/x/file.txt");

        // Then
        assertStatus(response, GateStatus.STOP);
        assertEquals("Artifact matching immutable/x/file.txt already exists in JPD: a:r/immutable/x/file.txt",
                response.message());
        assertEquals("r", response.identity().repoKey());
        assertEquals("immutable/x/file.txt", response.identity().path());
        assertTrue(response.headers().isEmpty(), "Headers should be empty");
    }

    @Test
    void testWarn_DuplicateFound_Warns() {
        // Given
        givenConfig(singleTargetConfig("a", "r", "immutable", "warn"));
        remoteSearch.store("a", "r", "immutable/x", "file.txt");

        // When
        GateResponse response = evaluate("r", "immutable/x/file.txt");

        // Then
        assertStatus(response, GateStatus.WARN);
        assertTrue(response.message().contains("a:r/immutable/x/file.txt"));
    }

    @Test
    void testBlock_NoDuplicate_Proceeds() {
        // Given
        givenConfig(singleTargetConfig("a", "r", "immutable", "block"));
        remoteSearch.store("a", "r", "immutable/x", "other.txt");

        // When
        GateResponse response = evaluate("r", "immutable/x/file.txt");

        // Then
        assertStatus(response, GateStatus.PROCEED);
        assertEquals("Artifact immutable/x/file.txt can be uploaded. No duplicates found.", response.message());
    }

    @Test
    void testUnknownAction_DuplicateFound_Stops() {
        // Given
        givenConfig(singleTargetConfig("a", "r", "immutable", "quarantine"));
        remoteSearch.store("a", "r", "immutable/x", "file.txt");

        // When
        GateResponse response = evaluate("r", "immutable/x/file.txt");

        // Then
        assertStatus(response, GateStatus.STOP);
        assertEquals("Unknown action 'quarantine' in config. Upload will not proceed.", response.message());
    }

    @Test
    void testUnknownAction_NoDuplicate_Proceeds() {
        // Given
        givenConfig(singleTargetConfig("a", "r", "immutable", "quarantine"));

        // When
        GateResponse response = evaluate("r", "immutable/x/file.txt");

        // Then
        assertStatus(response, GateStatus.PROCEED);
    }

    @Test
    void testTwoTargets_OnlyFirstMatches_MessageReferencesFirst() {
        // Given
        givenConfig("{\"jpds\":["
                + "{\"url\":\"a\",\"repos\":[{\"name\":\"r\",\"paths\":[\"immutable\"]}]},"
                + "{\"url\":\"b\",\"repos\":[{\"name\":\"r\",\"paths\":[\"immutable\"]}]}"
                + "],\"action\":\"block\"}");
        remoteSearch.store("a", "r", "immutable/x", "file.txt");
        remoteSearch.delay("b", 50);

        // When
        GateResponse response = evaluate("r", "immutable/x/file.txt");

        // Then
        assertStatus(response, GateStatus.STOP);
        assertTrue(response.message().contains("JPD: a:r/"),
                "Message should reference the matching target: " + response.message());
    }
}
