/**
 * Upload gate port package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.application.gate.UploadGate} - Entry point: evaluate one upload event</li>
 *   <li>{@link com.ryuqq.uploadgate.application.gate.GateResponse} - Status, message, identity, headers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.uploadgate.application.gate;
