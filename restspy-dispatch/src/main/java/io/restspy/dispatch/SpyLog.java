package io.restspy.dispatch;

import io.restspy.core.SpyRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-port, append-only record of dispatched requests.
 *
 * <p>Not thread-safe, like {@link io.restspy.core.MatchableRegistry}.
 */
public final class SpyLog {

    private final Map<Integer, List<SpyRecord>> byPort = new HashMap<>();

    public void record(int port, SpyRecord entry) {
        byPort.computeIfAbsent(port, p -> new ArrayList<>()).add(entry);
    }

    public List<SpyRecord> entries(int port) {
        List<SpyRecord> entries = byPort.get(port);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    public void reset(int port) {
        byPort.remove(port);
    }
}
