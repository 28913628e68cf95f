/**
 * Upload gating policy package.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.core.policy.PolicyEngine} - Maps (found, action) to a decision</li>
 *   <li>{@link com.ryuqq.uploadgate.core.policy.Decision} - Status + message + upload identity</li>
 *   <li>{@link com.ryuqq.uploadgate.core.policy.GateStatus} - PROCEED, STOP, WARN</li>
 *   <li>{@link com.ryuqq.uploadgate.core.policy.GateAction} - Configured reaction to a duplicate</li>
 * </ul>
 *
 * <h2>Failure Policy</h2>
 * <ul>
 *   <li><strong>Fail-closed:</strong> an unknown action with a duplicate found yields STOP</li>
 *   <li><strong>No duplicate:</strong> always PROCEED regardless of action</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.uploadgate.core.policy;
