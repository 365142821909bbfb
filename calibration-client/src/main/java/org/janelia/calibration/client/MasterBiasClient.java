package org.janelia.calibration.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.calibration.FileFailure;
import org.janelia.calibration.GroupOutcome;
import org.janelia.calibration.MasterFrameMaker;
import org.janelia.calibration.RunConfig;
import org.janelia.calibration.RunOutcome;
import org.janelia.calibration.client.parameter.CombineParameters;
import org.janelia.calibration.client.parameter.CommandLineParameters;
import org.janelia.calibration.client.parameter.DispositionParameters;
import org.janelia.calibration.client.parameter.GroupingParameters;
import org.janelia.calibration.client.parameter.OutputParameters;
import org.janelia.calibration.client.parameter.PrecalibrationParameters;
import org.janelia.calibration.disposition.FileDisposition;
import org.janelia.calibration.group.GroupingConfig;
import org.janelia.calibration.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for combining bias frames into master bias frames.
 */
public class MasterBiasClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public CombineParameters combine = new CombineParameters();

        @ParametersDelegate
        public GroupingParameters grouping = new GroupingParameters();

        @ParametersDelegate
        public PrecalibrationParameters precalibration = new PrecalibrationParameters();

        @ParametersDelegate
        public OutputParameters output = new OutputParameters();

        @ParametersDelegate
        public DispositionParameters disposition = new DispositionParameters();

        @Parameter(
                names = "--numberOfThreads",
                description = "Number of groups to process concurrently (default is number of available processors)")
        public Integer numberOfThreads;

        @Parameter(
                names = "--outcomeFile",
                description = "Write a JSON description of the run outcome to this file")
        public String outcomeFile;

        @Parameter(
                names = "--logDirectory",
                description = "Also write log output to a timestamped file in this directory")
        public String logDirectory;

        @Parameter(
                names = "--gui",
                description = "Open the interactive window (not available in this distribution)",
                arity = 0)
        public boolean gui = false;

        @Parameter(
                description = "Input FITS files")
        public List<String> inputFiles = new ArrayList<>();

        /**
         * @throws IllegalArgumentException
         *   if any options are invalid or inconsistent.
         */
        public RunConfig toRunConfig()
                throws IllegalArgumentException {

            if (gui) {
                throw new IllegalArgumentException(
                        "--gui is not supported, this distribution only provides the command line interface");
            }

            final GroupingConfig groupingConfig = grouping.toConfig();

            final RunConfig.Builder builder = RunConfig.newBuilder()
                    .withCombineConfig(combine.toConfig())
                    .withGroupingConfig(groupingConfig)
                    .withPrecalibrationConfig(precalibration.toConfig())
                    .withOutputConfig(output.toConfig(groupingConfig))
                    .withDispositionConfig(disposition.toConfig());

            if (numberOfThreads != null) {
                if (numberOfThreads < 1) {
                    throw new IllegalArgumentException("--numberOfThreads must be > 0");
                }
                builder.withNumberOfThreads(numberOfThreads);
            }

            return builder.build();
        }

        @Override
        protected List<String> getMainParameterValues() {
            return inputFiles;
        }

        public List<Path> getInputPaths() {
            return inputFiles.stream().map(Path::of).collect(Collectors.toList());
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                if (parameters.logDirectory != null) {
                    LogbackTools.setRootFileAppenderWithTimestamp(new File(parameters.logDirectory),
                                                                  "master_bias");
                }

                LOG.info("runClient: entry, parameters={}", parameters);

                final MasterBiasClient client = new MasterBiasClient(parameters);
                final RunOutcome outcome = client.run();

                if (! outcome.isSuccessful()) {
                    throw new IllegalStateException("run did not complete successfully, " + outcome.getSummary());
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final RunConfig runConfig;

    /**
     * @throws IllegalArgumentException
     *   if the parameters are invalid.
     */
    public MasterBiasClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.parameters = parameters;
        this.runConfig = parameters.toRunConfig();
    }

    public RunConfig getRunConfig() {
        return runConfig;
    }

    /**
     * Combines the input files, logs what happened, and saves the outcome file if one was requested.
     *
     * @return outcome of the run.
     */
    public RunOutcome run()
            throws InterruptedException, IOException {

        final MasterFrameMaker maker = new MasterFrameMaker();
        final RunOutcome outcome = maker.run(parameters.getInputPaths(), runConfig);

        logOutcome(outcome);

        if (parameters.outcomeFile != null) {
            FileUtil.saveJsonFile(parameters.outcomeFile, outcome);
        }

        return outcome;
    }

    private static void logOutcome(final RunOutcome outcome) {

        for (final FileFailure failure : outcome.getReadFailures()) {
            LOG.warn("logOutcome: unreadable {}", failure);
        }
        for (final FileFailure exclusion : outcome.getExclusions()) {
            LOG.info("logOutcome: excluded {}", exclusion);
        }
        outcome.getDroppedGroups().forEach(dg -> LOG.info("logOutcome: dropped group {}", dg));

        for (final GroupOutcome groupOutcome : outcome.getGroupOutcomes()) {
            if (groupOutcome.isWritten()) {
                LOG.info("logOutcome: {}", groupOutcome);
            } else {
                LOG.error("logOutcome: {}", groupOutcome);
            }
            for (final FileDisposition disposition : groupOutcome.getDispositions()) {
                if (! disposition.isMoved()) {
                    LOG.warn("logOutcome: {}", disposition);
                }
            }
        }

        if (outcome.getStatus().isFatal()) {
            LOG.error("logOutcome: run failed ({}), {}", outcome.getStatus().getFailureType(), outcome.getSummary());
        } else {
            LOG.info("logOutcome: {}", outcome.getSummary());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(MasterBiasClient.class);
}
