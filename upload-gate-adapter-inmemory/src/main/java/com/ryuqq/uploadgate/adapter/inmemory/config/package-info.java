/**
 * In-memory ConfigStore adapter package.
 *
 * <p>{@link com.ryuqq.uploadgate.adapter.inmemory.config.InMemoryConfigStore} keeps
 * configuration documents in a {@link java.util.concurrent.ConcurrentHashMap} and counts
 * reads, which lets tests verify that the gate re-reads the configuration per event.</p>
 *
 * @see com.ryuqq.uploadgate.core.spi.ConfigStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.uploadgate.adapter.inmemory.config;
