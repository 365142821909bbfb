package org.janelia.calibration.precalibration;

import org.janelia.calibration.DimensionMismatchException;
import org.janelia.calibration.IncompleteMetadataException;
import org.janelia.calibration.UnreadableFileException;
import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.FramePixels;
import org.janelia.calibration.frame.FrameReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtracts a pedestal or a bias frame from input pixels.
 * Adjusted samples are floored at zero.
 * Instances are immutable after construction and may be shared across worker threads.
 */
public class Precalibrator {

    private final PrecalibrationConfig config;
    private final FramePixels biasPixels;

    private Precalibrator(final PrecalibrationConfig config,
                          final FramePixels biasPixels) {
        this.config = config;
        this.biasPixels = biasPixels;
    }

    /**
     * Builds a precalibrator, loading the configured bias frame (if any).
     *
     * @throws UnreadableFileException
     *   if the bias frame cannot be read.
     *
     * @throws IncompleteMetadataException
     *   if the bias frame does not describe a two dimensional image.
     *
     * @throws DimensionMismatchException
     *   if the bias frame data does not match its own header.
     */
    public static Precalibrator load(final PrecalibrationConfig config,
                                     final FrameReader frameReader)
            throws UnreadableFileException, IncompleteMetadataException, DimensionMismatchException {

        FramePixels biasPixels = null;
        if (config.getMode() == PrecalibrationMode.BIAS_FRAME) {
            final Frame biasFrame = frameReader.readFrame(config.getBiasFramePath());
            biasPixels = frameReader.readPixels(biasFrame);
            LOG.info("load: loaded {} bias frame from {}", biasPixels, biasFrame.getPath());
        }

        return new Precalibrator(config, biasPixels);
    }

    /**
     * @return precalibrator that uses already loaded bias pixels.
     */
    public static Precalibrator forBiasPixels(final PrecalibrationConfig config,
                                              final FramePixels biasPixels) {
        return new Precalibrator(config, biasPixels);
    }

    public PrecalibrationConfig getConfig() {
        return config;
    }

    public boolean isActive() {
        return config.getMode() != PrecalibrationMode.NONE;
    }

    /**
     * @param  pixels  input frame pixels (not modified).
     *
     * @return new adjusted pixels, or the input instance when precalibration is disabled.
     *
     * @throws DimensionMismatchException
     *   if the bias frame dimensions differ from the input dimensions.
     */
    public FramePixels apply(final FramePixels pixels)
            throws DimensionMismatchException {

        final FramePixels result;
        switch (config.getMode()) {
            case PEDESTAL:
                result = subtract(pixels, config.getPedestal());
                break;
            case BIAS_FRAME:
                result = subtract(pixels, biasPixels);
                break;
            default:
                result = pixels;
        }
        return result;
    }

    private static FramePixels subtract(final FramePixels pixels,
                                        final double pedestal) {
        final double[] samples = pixels.getSamples();
        final double[] adjusted = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            adjusted[i] = Math.max(0.0, samples[i] - pedestal);
        }
        return new FramePixels(pixels.getWidth(), pixels.getHeight(), adjusted);
    }

    private static FramePixels subtract(final FramePixels pixels,
                                        final FramePixels bias)
            throws DimensionMismatchException {

        if (! pixels.hasSameDimensions(bias)) {
            throw new DimensionMismatchException("bias frame is " + bias + " but input frame is " + pixels);
        }

        final double[] samples = pixels.getSamples();
        final double[] biasSamples = bias.getSamples();
        final double[] adjusted = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            adjusted[i] = Math.max(0.0, samples[i] - biasSamples[i]);
        }
        return new FramePixels(pixels.getWidth(), pixels.getHeight(), adjusted);
    }

    private static final Logger LOG = LoggerFactory.getLogger(Precalibrator.class);
}
