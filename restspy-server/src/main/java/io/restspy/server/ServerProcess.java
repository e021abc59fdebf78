package io.restspy.server;

/**
 * A running server process owned by exactly one {@link LocalServer}.
 */
public interface ServerProcess {

    boolean isAlive();

    /**
     * Terminates the process. Calling it on a process that already exited does nothing.
     */
    void stop();
}
