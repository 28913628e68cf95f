/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the external collaborators the gate depends on. Adapter
 * modules provide the concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uploadgate.core.spi.ConfigStore} - Raw configuration text by key (fails open to "")</li>
 *   <li>{@link com.ryuqq.uploadgate.core.spi.RemoteSearch} - Existence query against one federation target</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>upload-gate-adapter-inmemory provides map-backed implementations for tests;
 * upload-gate-adapter-http provides the HTTP store and the AQL search client.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on transport</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.uploadgate.core.spi;
