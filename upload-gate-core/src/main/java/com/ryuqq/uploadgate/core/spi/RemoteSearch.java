package com.ryuqq.uploadgate.core.spi;

import com.ryuqq.uploadgate.core.model.ExistenceQuery;
import com.ryuqq.uploadgate.core.model.FoundItem;

import java.util.List;

/**
 * Remote existence-query SPI.
 *
 * <p>Submits a structured {@link ExistenceQuery} to one federation target and returns
 * the matching items. The query language used on the wire is the implementation's
 * concern.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Support single-repo, multi-repo (OR), single-path prefix, multi-path (OR) prefix
 *       and single-name filters</li>
 *   <li>Return at most {@link ExistenceQuery#limit()} items, in the target's order</li>
 *   <li>Every returned item carries the queried target URL</li>
 *   <li>Throw {@link RemoteSearchException} on network or protocol failures</li>
 *   <li>Thread-safe: the searcher calls it from several worker threads at once</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RemoteSearch {

    /**
     * Finds items matching the query on the given target.
     *
     * @param targetUrl the federation target (host) to query
     * @param query the existence filter
     * @return matching items (may be empty, never null)
     * @throws RemoteSearchException if the remote call fails
     */
    List<FoundItem> find(String targetUrl, ExistenceQuery query);
}
