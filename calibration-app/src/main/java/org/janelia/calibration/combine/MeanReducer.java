package org.janelia.calibration.combine;

/**
 * Arithmetic mean of all samples.
 */
public class MeanReducer
        implements SampleReducer {

    @Override
    public double reduce(final double[] samples) {
        return SampleReducer.mean(samples, 0, samples.length);
    }

}
