package org.janelia.calibration.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Path;

import org.janelia.calibration.group.GroupingConfig;
import org.janelia.calibration.output.OutputConfig;

/**
 * Parameters for locating master frame output files.
 */
public class OutputParameters
        implements Serializable {

    @Parameter(
            names = "--outputPath",
            description = "Path of the master frame file (only valid when frames are not grouped)")
    public String outputPath;

    @Parameter(
            names = "--outputDirectory",
            description = "Directory for master frame files (default is the directory of each group's first input)")
    public String outputDirectory;

    @Parameter(
            names = "--outputNameTemplate",
            description = "Master frame file name template.  Tokens: %d date, %t time, %f filter, %m method, " +
                          "%x dimensions, %b binning, %c temperature, %e exposure, %% percent sign")
    public String outputNameTemplate = OutputConfig.DEFAULT_NAME_TEMPLATE;

    /**
     * @throws IllegalArgumentException
     *   if output options conflict with each other or with grouping.
     */
    public OutputConfig toConfig(final GroupingConfig groupingConfig)
            throws IllegalArgumentException {

        final OutputConfig config;
        if (outputPath != null) {
            if (outputDirectory != null) {
                throw new IllegalArgumentException("--outputPath and --outputDirectory cannot both be specified");
            }
            if (groupingConfig.isGrouping()) {
                throw new IllegalArgumentException(
                        "--outputPath cannot be used with --groupBySize or --groupByTemperature, " +
                        "specify --outputDirectory instead");
            }
            config = OutputConfig.singlePath(Path.of(outputPath));
        } else if (outputDirectory != null) {
            config = OutputConfig.directory(Path.of(outputDirectory), outputNameTemplate);
        } else {
            config = OutputConfig.besideInputs(outputNameTemplate);
        }

        return config;
    }
}
