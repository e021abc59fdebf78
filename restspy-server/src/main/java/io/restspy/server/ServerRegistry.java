package io.restspy.server;

import io.restspy.core.RestSpyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Directory of running {@link LocalServer}s, one per port.
 *
 * <p>The registry lock is the single serialization point for lifecycle changes:
 * registration, unregistration, snapshots, and the whole of {@link LocalServer#start()}
 * and {@link LocalServer#stop()} run while holding it.
 *
 * <p>The test harness owns an instance and calls {@link #shutdown()} at the end of the
 * run. {@link #registerShutdownHook()} makes the JVM do it on exit instead.
 */
public final class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    private final Map<Integer, LocalServer> servers = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean shutDown = new AtomicBoolean();

    /**
     * Returns the lock guarding this registry and every lifecycle transition that uses it.
     */
    public ReentrantLock lock() {
        return lock;
    }

    /**
     * @throws RestSpyException.DuplicatePort if a server is already registered for the port
     */
    public void register(LocalServer server) {
        lock.lock();
        try {
            if (servers.containsKey(server.port())) {
                throw new RestSpyException.DuplicatePort(server.port());
            }
            servers.put(server.port(), server);
            log.debug("Registered server on port {}", server.port());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the server's entry. Another server registered for the same port is left alone.
     *
     * @return true if an entry was removed, false if this server was not registered
     */
    public boolean unregister(LocalServer server) {
        lock.lock();
        try {
            if (!servers.remove(server.port(), server)) {
                return false;
            }
            log.debug("Unregistered server on port {}", server.port());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(int port) {
        lock.lock();
        try {
            return servers.containsKey(port);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return servers.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Visits every registered server. The set is snapshotted under the lock, so the
     * visitor may start or stop servers.
     */
    public void forEach(Consumer<LocalServer> visitor) {
        for (LocalServer server : snapshot()) {
            visitor.accept(server);
        }
    }

    /**
     * Stops every registered server. Runs at most once; later calls do nothing.
     * A server that fails to stop is logged and the remaining ones are still stopped.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        forEach(server -> {
            try {
                server.stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop server on port {} during shutdown", server.port(), e);
            }
        });
    }

    /**
     * Installs a JVM shutdown hook that calls {@link #shutdown()}.
     */
    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "restspy-shutdown"));
    }

    private List<LocalServer> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(servers.values());
        } finally {
            lock.unlock();
        }
    }
}
