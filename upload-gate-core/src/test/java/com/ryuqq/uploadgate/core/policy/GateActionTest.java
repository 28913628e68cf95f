package com.ryuqq.uploadgate.core.policy;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GateAction 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GateActionTest {

    @Test
    void from_KnownValues_Resolved() {
        assertEquals(Optional.of(GateAction.BLOCK), GateAction.from("block"));
        assertEquals(Optional.of(GateAction.WARN), GateAction.from("warn"));
    }

    @Test
    void from_CaseMismatchOrNull_Empty() {
        assertTrue(GateAction.from("BLOCK").isEmpty());
        assertTrue(GateAction.from(null).isEmpty());
    }

    @Test
    void decision_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Decision.stop(" ", null));
    }
}
