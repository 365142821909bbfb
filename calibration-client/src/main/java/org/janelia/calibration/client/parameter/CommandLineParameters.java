package org.janelia.calibration.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import org.janelia.calibration.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for all command line tools.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed and exitOnHelpOrFailure is false.
     */
    public void parse(final String[] args,
                      final Class<?> programClass,
                      final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName("java -cp calibration-client-standalone.jar " + programClass.getName())
                .build();

        String failureMessage = null;
        try {
            jCommander.parse(args);
            for (final String value : getMainParameterValues()) {
                if (value.startsWith("--")) {
                    throw new ParameterException("unknown option '" + value + "'");
                }
            }
        } catch (final ParameterException pe) {
            failureMessage = pe.getMessage();
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + failureMessage);
        } catch (final Throwable t) {
            failureMessage = t.getMessage();
            LOG.error("failed to parse command line arguments", t);
        }

        final boolean parseFailed = failureMessage != null;
        if (help || parseFailed) {
            jCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            } else if (parseFailed) {
                throw new IllegalArgumentException(failureMessage);
            }
        }
    }

    /**
     * JCommander passes options it does not recognize through as main parameter values,
     * so subclasses with a main parameter return its values here to have them checked.
     *
     * @return values bound to the main parameter.
     */
    protected List<String> getMainParameterValues() {
        return Collections.emptyList();
    }

    /**
     * @return string representation of these parameters.
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
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
