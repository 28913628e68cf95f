/**
 * HTTP adapters for the storage platform.
 *
 * <p>{@link com.ryuqq.uploadgate.adapter.http.HttpConfigStore} reads the gate configuration
 * document from the local platform. {@link com.ryuqq.uploadgate.adapter.http.AqlRemoteSearch}
 * renders each existence query as AQL via {@link com.ryuqq.uploadgate.adapter.http.AqlQueryBuilder}
 * and posts it to a remote target's search endpoint.</p>
 *
 * <p>Both share one immutable {@link com.ryuqq.uploadgate.adapter.http.HttpAdapterConfig}.
 * Transport failures surface as
 * {@link com.ryuqq.uploadgate.core.spi.RemoteSearchException} for searches and as an
 * empty document for configuration reads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.uploadgate.adapter.http;
