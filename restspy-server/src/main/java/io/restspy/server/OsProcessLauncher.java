package io.restspy.server;

import io.restspy.core.RestSpyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder}.
 *
 * <p>Stopping a process first asks it to terminate and waits up to the grace period
 * before killing it.
 */
public final class OsProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(OsProcessLauncher.class);

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(3);

    private final Duration gracePeriod;

    public OsProcessLauncher() {
        this(DEFAULT_GRACE_PERIOD);
    }

    public OsProcessLauncher(Duration gracePeriod) {
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
    }

    @Override
    public ServerProcess launch(List<String> command) throws IOException {
        Process process = new ProcessBuilder(command).inheritIO().start();
        log.debug("Launched {} as pid {}", command, process.pid());
        return new OsProcess(process, gracePeriod);
    }

    private static final class OsProcess implements ServerProcess {
        private final Process process;
        private final Duration gracePeriod;

        OsProcess(Process process, Duration gracePeriod) {
            this.process = process;
            this.gracePeriod = gracePeriod;
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void stop() {
            if (!process.isAlive()) return;

            process.destroy();
            try {
                if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.debug("pid {} ignored termination request, killing it", process.pid());
                    process.destroyForcibly().waitFor();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new RestSpyException.Interrupted("Interrupted while stopping pid " + process.pid(), e);
            }
        }

        @Override
        public String toString() {
            return "OsProcess{pid=" + process.pid() + "}";
        }
    }
}
