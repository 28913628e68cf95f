package com.ryuqq.uploadgate.core.spi;

/**
 * Configuration blob store SPI.
 *
 * <p>Provides the raw text of the federation configuration document. The gate
 * reads it once per upload event; implementations must not cache across events
 * unless the backing store itself does.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Never throw: any load failure (unreachable store, missing key, bad status) returns an empty string</li>
 *   <li>Never return null</li>
 *   <li>Thread-safe: may be called concurrently for different upload events</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ConfigStore {

    /**
     * Reads the text stored under the given key.
     *
     * @param key the configuration key (e.g., {@code worker-config/blocker-config.json})
     * @return the stored text, or an empty string if it cannot be loaded
     */
    String getText(String key);
}
