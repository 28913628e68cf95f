/**
 * In-memory RemoteSearch adapter package.
 *
 * <p>This package provides a reference implementation of the RemoteSearch SPI
 * for contract tests and local wiring.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.adapter.inmemory.search.InMemoryRemoteSearch}:
 *       per-target item lists, failure and latency injection, call recording</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.uploadgate.core.spi.RemoteSearch
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.uploadgate.adapter.inmemory.search;
