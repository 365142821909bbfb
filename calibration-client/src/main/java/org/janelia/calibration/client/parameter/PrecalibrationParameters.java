package org.janelia.calibration.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Path;

import org.janelia.calibration.precalibration.PrecalibrationConfig;

/**
 * Parameters for adjusting input frames before they are combined.
 */
public class PrecalibrationParameters
        implements Serializable {

    @Parameter(
            names = "--pedestal",
            description = "Constant value to subtract from every input sample")
    public Double pedestal;

    @Parameter(
            names = "--biasFrame",
            description = "Path of an existing master bias frame to subtract from every input frame")
    public String biasFrame;

    public PrecalibrationConfig toConfig()
            throws IllegalArgumentException {

        final PrecalibrationConfig config;
        if ((pedestal != null) && (biasFrame != null)) {
            throw new IllegalArgumentException("--pedestal and --biasFrame cannot both be specified");
        } else if (pedestal != null) {
            config = PrecalibrationConfig.pedestal(pedestal);
        } else if (biasFrame != null) {
            config = PrecalibrationConfig.biasFrame(Path.of(biasFrame));
        } else {
            config = PrecalibrationConfig.none();
        }

        return config;
    }
}
