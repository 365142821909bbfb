package org.janelia.calibration.combine;

/**
 * Reduces the sample vector for one pixel position to a single value.
 *
 * Implementations may reorder the contents of the samples array
 * but must produce results that do not depend on the original order.
 */
public interface SampleReducer {

    /**
     * @param  samples  values for one pixel position across all frames (never empty).
     *
     * @return the reduced value.
     */
    double reduce(final double[] samples);

    /**
     * @return reducer implementing the specified configuration.
     */
    static SampleReducer forConfig(final CombineConfig config) {
        final SampleReducer reducer;
        switch (config.getMethod()) {
            case MEDIAN:
                reducer = new MedianReducer();
                break;
            case MIN_MAX_CLIP:
                reducer = new MinMaxClipReducer(config.getClipCount());
                break;
            case SIGMA_CLIP:
                reducer = new SigmaClipReducer(config.getSigmaThreshold());
                break;
            default:
                reducer = new MeanReducer();
        }
        return reducer;
    }

    static double mean(final double[] samples,
                       final int fromIndex,
                       final int toIndex) {
        double sum = 0.0;
        for (int i = fromIndex; i < toIndex; i++) {
            sum += samples[i];
        }
        return sum / (toIndex - fromIndex);
    }

}
