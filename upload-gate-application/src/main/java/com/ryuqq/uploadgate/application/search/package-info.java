/**
 * Federated search port package.
 *
 * <p>Defines the fan-out/fan-in contract used by the gate. The runner adapter
 * provides the thread-pool implementation.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.uploadgate.application.search;
