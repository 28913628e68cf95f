/**
 * Search scope resolution package.
 *
 * <p>{@link com.ryuqq.uploadgate.core.scope.ScopeResolver} selects the
 * (target, repo scope) pairs relevant to an upload using a boundary-safe
 * directory prefix match. An empty result is the no-scope fast path.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.uploadgate.core.scope;
