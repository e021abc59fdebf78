package io.restspy.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-port ordered collection of {@link Matchable}s.
 *
 * <p>Registration order is kept and is the only tie-break between overlapping patterns:
 * {@link #findForEndpoint} returns the most recently registered match, so a later
 * registration for the same pattern shadows an earlier one.
 *
 * <p>This class is not thread-safe. Confine an instance to one thread or guard it
 * externally.
 *
 * @param <T> the matchable type held by this registry
 */
public final class MatchableRegistry<T extends Matchable> {

    private static final Logger log = LoggerFactory.getLogger(MatchableRegistry.class);

    private final Map<Integer, List<T>> byPort = new HashMap<>();

    public void register(T matchable, int port) {
        byPort.computeIfAbsent(port, p -> new ArrayList<>()).add(matchable);
        log.debug("Registered {} on port {}", matchable, port);
    }

    public void unregister(String id, int port) {
        List<T> elements = byPort.get(port);
        if (elements == null) return;
        if (elements.removeIf(e -> e.id().equals(id))) {
            log.debug("Unregistered id {} from port {}", id, port);
        }
    }

    public void reset(int port) {
        List<T> elements = byPort.get(port);
        if (elements != null) {
            elements.clear();
        }
    }

    public Optional<T> findForEndpoint(String path, int port) {
        List<T> elements = byPort.get(port);
        if (elements == null) return Optional.empty();

        for (int i = elements.size() - 1; i >= 0; i--) {
            T candidate = elements.get(i);
            if (candidate.matches(path)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public List<T> findAllForEndpoint(String path, int port) {
        List<T> elements = byPort.get(port);
        if (elements == null) return List.of();

        List<T> out = new ArrayList<>();
        for (T candidate : elements) {
            if (candidate.matches(path)) {
                out.add(candidate);
            }
        }
        return out;
    }
}
