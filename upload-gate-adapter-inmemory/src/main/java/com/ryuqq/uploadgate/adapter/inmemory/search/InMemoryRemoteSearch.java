package com.ryuqq.uploadgate.adapter.inmemory.search;

import com.ryuqq.uploadgate.core.model.ExistenceQuery;
import com.ryuqq.uploadgate.core.model.FoundItem;
import com.ryuqq.uploadgate.core.spi.RemoteSearch;
import com.ryuqq.uploadgate.core.spi.RemoteSearchException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * In-memory implementation of {@link RemoteSearch} SPI for testing purposes.
 *
 * <p>Each federation target owns a list of stored items. Queries are evaluated
 * with the same semantics the remote query language applies:</p>
 * <ul>
 *   <li><strong>repos:</strong> item repo must be one of them (no restriction when empty)</li>
 *   <li><strong>pathPrefixes:</strong> item path must start with one of them</li>
 *   <li><strong>exactPath:</strong> item path must equal it when no prefixes are given</li>
 *   <li><strong>fileName:</strong> glob match ({@code *} and {@code ?} wildcards)</li>
 * </ul>
 *
 * <p><strong>Test Hooks:</strong></p>
 * <ul>
 *   <li>{@link #failOn(String, String)}: every query on the target throws {@link RemoteSearchException}</li>
 *   <li>{@link #delay(String, long)}: every query on the target sleeps before answering</li>
 *   <li>{@link #calls()}: recorded (target, query) pairs in arrival order</li>
 * </ul>
 *
 * <p>All operations are thread-safe.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryRemoteSearch implements RemoteSearch {

    /**
     * A recorded remote call.
     *
     * @param targetUrl the queried target
     * @param query the submitted filter
     */
    public record Call(String targetUrl, ExistenceQuery query) {
    }

    private final ConcurrentHashMap<String, List<FoundItem>> itemsByTarget = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> failures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> delays = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    @Override
    public List<FoundItem> find(String targetUrl, ExistenceQuery query) {
        calls.add(new Call(targetUrl, query));

        Long delayMs = delays.get(targetUrl);
        if (delayMs != null) {
            sleep(targetUrl, delayMs);
        }
        String failure = failures.get(targetUrl);
        if (failure != null) {
            throw new RemoteSearchException(targetUrl, failure);
        }

        List<FoundItem> result = new ArrayList<>();
        for (FoundItem item : itemsByTarget.getOrDefault(targetUrl, List.of())) {
            if (result.size() >= query.limit()) {
                break;
            }
            if (matches(item, query)) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Stores an item on a target.
     *
     * @param targetUrl the target host
     * @param repo the repository
     * @param path the directory path ("." for root)
     * @param name the file name
     * @return the stored item
     */
    public FoundItem store(String targetUrl, String repo, String path, String name) {
        FoundItem item = new FoundItem(targetUrl, repo, path, name);
        itemsByTarget.computeIfAbsent(targetUrl, key -> new CopyOnWriteArrayList<>()).add(item);
        return item;
    }

    /**
     * Makes every query on the target fail.
     *
     * @param targetUrl the target host
     * @param message the failure message
     */
    public void failOn(String targetUrl, String message) {
        failures.put(targetUrl, message);
    }

    /**
     * Delays every query on the target.
     *
     * @param targetUrl the target host
     * @param delayMs delay in milliseconds
     * @throws IllegalArgumentException if delayMs is negative
     */
    public void delay(String targetUrl, long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative");
        }
        delays.put(targetUrl, delayMs);
    }

    /**
     * Returns the recorded calls in arrival order.
     *
     * @return an immutable snapshot of recorded calls
     */
    public List<Call> calls() {
        return List.copyOf(calls);
    }

    /**
     * Returns the recorded calls for one target.
     *
     * @param targetUrl the target host
     * @return an immutable snapshot of that target's calls
     */
    public List<Call> callsTo(String targetUrl) {
        return calls.stream().filter(call -> call.targetUrl().equals(targetUrl)).toList();
    }

    /**
     * Clears items, failures, delays and recorded calls.
     */
    public void clear() {
        itemsByTarget.clear();
        failures.clear();
        delays.clear();
        calls.clear();
    }

    private static boolean matches(FoundItem item, ExistenceQuery query) {
        if (!query.repos().isEmpty() && !query.repos().contains(item.repo())) {
            return false;
        }
        if (query.usesPathPrefixes()) {
            if (query.pathPrefixes().stream().noneMatch(prefix -> item.path().startsWith(prefix))) {
                return false;
            }
        } else if (!query.exactPath().equals(item.path())) {
            return false;
        }
        return globToPattern(query.fileName()).matcher(item.name()).matches();
    }

    private static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private static void sleep(String targetUrl, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteSearchException(targetUrl, "Search interrupted", e);
        }
    }
}
