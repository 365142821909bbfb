package org.janelia.calibration.combine;

import java.util.Arrays;

/**
 * Median of all samples, averaging the two middle values when the sample count is even.
 */
public class MedianReducer
        implements SampleReducer {

    @Override
    public double reduce(final double[] samples) {
        Arrays.sort(samples);
        final int middle = samples.length / 2;
        final double median;
        if ((samples.length % 2) == 0) {
            median = (samples[middle - 1] + samples[middle]) / 2.0;
        } else {
            median = samples[middle];
        }
        return median;
    }

}
