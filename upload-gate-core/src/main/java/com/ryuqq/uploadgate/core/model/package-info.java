/**
 * Federation model package.
 *
 * <p>Immutable value types describing the federation configuration and the
 * transient values of one gate evaluation.</p>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.core.model.FederationConfig} - Targets + action</li>
 *   <li>{@link com.ryuqq.uploadgate.core.model.FederationTarget} - One remote instance (JPD)</li>
 *   <li>{@link com.ryuqq.uploadgate.core.model.RepoScope} - Repository + optional path roots</li>
 * </ul>
 *
 * <h2>Per-Upload Values</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.core.model.UploadEvent} - Repository key + path of the upload</li>
 *   <li>{@link com.ryuqq.uploadgate.core.model.ScopeMatch} - Target + optional repo scope to search</li>
 *   <li>{@link com.ryuqq.uploadgate.core.model.ExistenceQuery} - Structured filter sent to a target</li>
 *   <li>{@link com.ryuqq.uploadgate.core.model.FoundItem} - One match reported by a target</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.uploadgate.core.model;
