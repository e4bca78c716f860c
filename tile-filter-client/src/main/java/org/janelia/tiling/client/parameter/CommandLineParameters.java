package org.janelia.tiling.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.tiling.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for the tiling command line tools.
 *
 * Parsing never ends the process.  When help is requested or the arguments are invalid,
 * usage is printed and {@link #parse} returns false, leaving the exit code to the caller
 * (see {@link #getStopExitCode()}).
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient String parseError;

    public CommandLineParameters() {
        this.help = false;
        this.parseError = null;
    }

    /**
     * Parses arguments for the client class that encloses this parameters class.
     *
     * @return true if the client should run, false if help was requested or the arguments are invalid.
     */
    public boolean parse(final String[] args) {
        return parse(args, this.getClass().getEnclosingClass());
    }

    /**
     * @param  args          command line arguments.
     * @param  programClass  client class named in the usage text.
     *
     * @return true if the client should run, false if help was requested or the arguments are invalid.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass) {

        final JCommander jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp tile-filter-client.jar " + programClass.getName());

        parseError = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            parseError = pe.getMessage();
            LOG.warn("parse: invalid arguments for {}, {}", programClass.getSimpleName(), parseError);
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + parseError);
        }

        final boolean readyToRun = (! help) && (parseError == null);
        if (! readyToRun) {
            jCommander.getConsole().println("");
            jCommander.usage();
        }

        return readyToRun;
    }

    /**
     * @return message describing why the last parse failed, or null if it succeeded.
     */
    public String getParseError() {
        return parseError;
    }

    /**
     * @return exit code for a client that stops after {@link #parse} returned false:
     *         0 when help was requested, {@link #USAGE_EXIT_CODE} for invalid arguments.
     */
    public int getStopExitCode() {
        return (help && (parseError == null)) ? 0 : USAGE_EXIT_CODE;
    }

    /**
     * @return JSON representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Parses a help request for the specified parameters (used by tests).
     *
     * @return result of the parse (always false for a help request).
     */
    public static boolean parseHelp(final CommandLineParameters parameters) {
        return parameters.parse(new String[] { "--help" },
                                parameters.getClass().getEnclosingClass());
    }

    public static final int USAGE_EXIT_CODE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
