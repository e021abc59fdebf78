package io.restspy.server;

import io.restspy.core.RestSpyException;
import io.restspy.http.spi.HttpClientAdapter;
import io.restspy.http.spi.HttpClientException;
import io.restspy.http.spi.HttpClientRequest;
import io.restspy.http.spi.HttpConnectException;
import io.restspy.http.spi.HttpTimeoutException;
import io.restspy.http.spi.JdkHttpClientAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A mock server running as a child process on a local port.
 *
 * <p>{@link #start()} registers the server, launches {@code <command> -p <port>} and
 * blocks until the server answers a plain GET on its base URL or the readiness timeout
 * passes. {@link #stop()} is idempotent. Both hold the {@link ServerRegistry} lock for
 * their whole duration, readiness polling included, so concurrent starts serialize.
 */
public final class LocalServer extends AbstractServer {

    private static final Logger log = LoggerFactory.getLogger(LocalServer.class);

    public static final String DEFAULT_COMMAND = "rest-spy";
    public static final String DEFAULT_HOST = "localhost";
    public static final Duration DEFAULT_READINESS_TIMEOUT = Duration.ofSeconds(3);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    public enum State {
        STOPPED,
        STARTING,
        RUNNING
    }

    private final int port;
    private final ServerRegistry registry;
    private final ProcessLauncher launcher;
    private final List<String> command;
    private final Duration readinessTimeout;
    private final Duration pollInterval;

    private volatile State state = State.STOPPED;
    private ServerProcess process;

    private LocalServer(Builder builder) {
        super(URI.create("http://" + builder.host + ":" + builder.port + "/"), builder.httpClient);
        this.port = builder.port;
        this.registry = builder.registry;
        this.launcher = builder.launcher;
        this.command = List.of(builder.command, "-p", Integer.toString(builder.port));
        this.readinessTimeout = builder.readinessTimeout;
        this.pollInterval = builder.pollInterval;
    }

    public static Builder builder(ServerRegistry registry, int port) {
        return new Builder(registry, port);
    }

    public int port() {
        return port;
    }

    public State state() {
        return state;
    }

    List<String> command() {
        return command;
    }

    /**
     * @throws RestSpyException.DuplicatePort if a server already runs on this port, including this one
     * @throws RestSpyException.Timeout if the server is not reachable within the readiness timeout
     * @throws RestSpyException.ProcessFailure if the process cannot be launched
     */
    @Override
    public void start() {
        ReentrantLock lock = registry.lock();
        lock.lock();
        try {
            registry.register(this);
            state = State.STARTING;
            try {
                process = launchProcess();
                waitUntilRunning();
            } catch (RuntimeException e) {
                abandonStart();
                throw e;
            }
            state = State.RUNNING;
            log.info("Server on port {} is running", port);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        ReentrantLock lock = registry.lock();
        lock.lock();
        try {
            if (!registry.unregister(this)) {
                return;
            }
            stopProcess();
            log.info("Server on port {} stopped", port);
        } finally {
            lock.unlock();
        }
    }

    private ServerProcess launchProcess() {
        try {
            return launcher.launch(command);
        } catch (IOException e) {
            throw new RestSpyException.ProcessFailure("Failed to launch " + command, e);
        }
    }

    private void waitUntilRunning() {
        long deadline = System.nanoTime() + readinessTimeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new RestSpyException.Timeout(
                        "Server on port " + port + " not reachable within " + readinessTimeout, readinessTimeout);
            }
            if (reachable(atLeastOneMilli(remaining))) {
                return;
            }
            sleep(pollInterval.toNanos() < remaining ? pollInterval : atLeastOneMilli(remaining));
        }
    }

    /**
     * A single readiness attempt, bounded by {@code attemptTimeout}. Refused connections
     * and unanswered requests both count as not ready.
     */
    private boolean reachable(Duration attemptTimeout) {
        try {
            httpClient().send(HttpClientRequest.get(baseUrl()).timeout(attemptTimeout).build());
            return true;
        } catch (HttpConnectException e) {
            log.debug("Server on port {} not accepting connections yet", port);
            return false;
        } catch (HttpTimeoutException e) {
            log.debug("Server on port {} accepted but did not answer within {}", port, attemptTimeout);
            return false;
        } catch (HttpClientException e) {
            throw new RestSpyException.Transport("Readiness check of " + baseUrl() + " failed", e);
        }
    }

    // adapters truncate timeouts to milliseconds, and zero means no timeout for some of them
    private static Duration atLeastOneMilli(long nanos) {
        return Duration.ofMillis(Math.max(1, TimeUnit.NANOSECONDS.toMillis(nanos)));
    }

    private void abandonStart() {
        registry.unregister(this);
        try {
            stopProcess();
        } catch (RuntimeException e) {
            log.warn("Failed to stop process of server on port {} after failed start", port, e);
        }
    }

    private void stopProcess() {
        ServerProcess owned = process;
        process = null;
        state = State.STOPPED;
        if (owned != null) {
            owned.stop();
        }
    }

    private static void sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestSpyException.Interrupted("Interrupted while waiting for server readiness", e);
        }
    }

    public static final class Builder {
        private final ServerRegistry registry;
        private final int port;
        private String command = DEFAULT_COMMAND;
        private String host = DEFAULT_HOST;
        private ProcessLauncher launcher;
        private HttpClientAdapter httpClient;
        private Duration readinessTimeout = DEFAULT_READINESS_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        private Builder(ServerRegistry registry, int port) {
            this.registry = Objects.requireNonNull(registry, "registry");
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
        }

        public Builder command(String command) {
            this.command = Objects.requireNonNull(command, "command");
            return this;
        }

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder launcher(ProcessLauncher launcher) {
            this.launcher = Objects.requireNonNull(launcher, "launcher");
            return this;
        }

        public Builder httpClient(HttpClientAdapter httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            return this;
        }

        public Builder readinessTimeout(Duration readinessTimeout) {
            this.readinessTimeout = Objects.requireNonNull(readinessTimeout, "readinessTimeout");
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
            return this;
        }

        public LocalServer build() {
            if (launcher == null) {
                launcher = new OsProcessLauncher();
            }
            if (httpClient == null) {
                httpClient = JdkHttpClientAdapter.create();
            }
            return new LocalServer(this);
        }
    }
}
