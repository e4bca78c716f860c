package org.janelia.tiling.client;

import org.janelia.tiling.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions
 * and overall process completion events.
 *
 * Absence of the standard exit log message indicates that the client was terminated abnormally
 * (e.g. killed without a chance to run its shutdown hooks).
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Wraps a run with consistent log statements and exits the JVM with the client's status.
     */
    public void run() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitCode;
        try {
            exitCode = runClient(args);
            LOG.info("run: exit, processing completed with status {} in {}", exitCode, processTimer);
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            exitCode = 1;
        }

        System.exit(exitCode);
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @return exit code for the process (0 for success).
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract int runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
