package com.phillippitts.voicebridge.service.bridge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the bridge can be tested without real subprocesses.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests supply fake {@link Process}
 * implementations with scripted stdout, stderr and exit behavior.
 */
interface ProcessFactory {
    /**
     * Starts a new process with the given command and working directory.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
