/**
 * Federation configuration parsing package.
 *
 * <p>Turns the raw configuration document into a normalized
 * {@link com.ryuqq.uploadgate.core.model.FederationConfig}. Parsing is tolerant:
 * malformed sub-entries are dropped and reported as diagnostics, and an unusable
 * document yields the empty fail-open configuration.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.core.config.ConfigParser} - JSON document parser (Jackson tree model)</li>
 *   <li>{@link com.ryuqq.uploadgate.core.config.ConfigParseResult} - Sealed interface (permits Parsed, Rejected)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.uploadgate.core.config;
