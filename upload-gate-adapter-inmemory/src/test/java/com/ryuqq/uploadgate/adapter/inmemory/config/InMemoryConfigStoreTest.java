package com.ryuqq.uploadgate.adapter.inmemory.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryConfigStore 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryConfigStoreTest {

    private final InMemoryConfigStore store = new InMemoryConfigStore();

    @Test
    void getText_StoredKey_ReturnsText() {
        // Given
        store.put("worker-config/blocker-config.json", "{\"jpds\":[]}");

        // When
        String text = store.getText("worker-config/blocker-config.json");

        // Then
        assertEquals("{\"jpds\":[]}", text);
        assertEquals(1, store.readCount("worker-config/blocker-config.json"));
    }

    @Test
    void getText_MissingKey_ReturnsEmptyText() {
        assertEquals("", store.getText("missing.json"));
        assertEquals("", store.getText(null));
    }

    @Test
    void remove_StoredKey_ReturnsEmptyTextAfterwards() {
        // Given
        store.put("k", "v");

        // When
        store.remove("k");

        // Then
        assertEquals("", store.getText("k"));
    }

    @Test
    void clear_ResetsTextsAndReadCounts() {
        // Given
        store.put("k", "v");
        store.getText("k");

        // When
        store.clear();

        // Then
        assertEquals(0, store.readCount("k"));
        assertEquals("", store.getText("k"));
    }

    @Test
    void put_NullText_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> store.put("k", null));
    }
}
