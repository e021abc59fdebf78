package io.restspy.server;

import java.io.IOException;
import java.util.List;

/**
 * Starts the process that backs a {@link LocalServer}.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * Starts {@code command} with the standard streams inherited from this JVM.
     *
     * @param command the executable followed by its arguments
     * @return the started process
     * @throws IOException if the process cannot be started
     */
    ServerProcess launch(List<String> command) throws IOException;
}
