package com.ryuqq.uploadgate.adapter.inmemory.config;

import com.ryuqq.uploadgate.core.spi.ConfigStore;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ConfigStore} SPI for testing and local wiring.
 *
 * <p>Keys map to raw text. A missing key yields an empty string, which the gate
 * treats as "no configuration" (fail-open).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryConfigStore implements ConfigStore {

    private final ConcurrentHashMap<String, String> texts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Integer> reads = new ConcurrentHashMap<>();

    @Override
    public String getText(String key) {
        if (key == null) {
            return "";
        }
        reads.merge(key, 1, Integer::sum);
        return texts.getOrDefault(key, "");
    }

    /**
     * Stores text under a key, replacing any previous value.
     *
     * @param key the configuration key
     * @param text the raw text
     * @throws IllegalArgumentException if key or text is null
     */
    public void put(String key, String text) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        texts.put(key, text);
    }

    /**
     * Removes the text stored under a key.
     *
     * @param key the configuration key
     */
    public void remove(String key) {
        texts.remove(key);
    }

    /**
     * Returns how many times a key has been read.
     *
     * @param key the configuration key
     * @return read count (0 if never read)
     */
    public int readCount(String key) {
        return reads.getOrDefault(key, 0);
    }

    /**
     * Clears all stored texts and read counters.
     */
    public void clear() {
        texts.clear();
        reads.clear();
    }
}
