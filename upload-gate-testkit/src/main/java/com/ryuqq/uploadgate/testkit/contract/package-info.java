/**
 * Contract test infrastructure for upload gate wirings.
 *
 * <p>{@link com.ryuqq.uploadgate.testkit.contract.AbstractGateContractTest} assembles the
 * gate from in-memory collaborators; concrete contract tests extend it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.uploadgate.testkit.contract;
