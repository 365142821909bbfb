package org.janelia.calibration.precalibration;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Immutable precalibration settings.
 */
public class PrecalibrationConfig
        implements Serializable {

    private final PrecalibrationMode mode;
    private final double pedestal;
    private final String biasFramePath;

    private PrecalibrationConfig(final PrecalibrationMode mode,
                                 final double pedestal,
                                 final String biasFramePath) {
        this.mode = mode;
        this.pedestal = pedestal;
        this.biasFramePath = biasFramePath;
    }

    public static PrecalibrationConfig none() {
        return new PrecalibrationConfig(PrecalibrationMode.NONE, 0.0, null);
    }

    /**
     * @throws IllegalArgumentException
     *   if the pedestal is not a finite number.
     */
    public static PrecalibrationConfig pedestal(final double pedestal)
            throws IllegalArgumentException {
        if (! Double.isFinite(pedestal)) {
            throw new IllegalArgumentException("pedestal must be a finite number, not " + pedestal);
        }
        return new PrecalibrationConfig(PrecalibrationMode.PEDESTAL, pedestal, null);
    }

    public static PrecalibrationConfig biasFrame(final Path biasFramePath)
            throws IllegalArgumentException {
        if (biasFramePath == null) {
            throw new IllegalArgumentException("bias frame path must be specified");
        }
        return new PrecalibrationConfig(PrecalibrationMode.BIAS_FRAME, 0.0, biasFramePath.toString());
    }

    public PrecalibrationMode getMode() {
        return mode;
    }

    public double getPedestal() {
        return pedestal;
    }

    public Path getBiasFramePath() {
        return biasFramePath == null ? null : Path.of(biasFramePath);
    }

    /**
     * @return short description for output metadata, or null when no precalibration is applied.
     */
    public String getDescription() {
        final String description;
        switch (mode) {
            case PEDESTAL:
                description = "pedestal " + pedestal;
                break;
            case BIAS_FRAME:
                description = "bias frame " + Path.of(biasFramePath).getFileName();
                break;
            default:
                description = null;
        }
        return description;
    }

    @Override
    public String toString() {
        return mode == PrecalibrationMode.NONE ? "none" : getDescription();
    }
}
