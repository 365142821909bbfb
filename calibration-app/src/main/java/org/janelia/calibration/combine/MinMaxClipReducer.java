package org.janelia.calibration.combine;

import java.util.Arrays;

/**
 * Mean of the samples remaining after the lowest and highest clip count values are dropped.
 *
 * When dropping clip count values from each end would leave nothing,
 * the clip count is reduced to the largest value that still leaves at least one sample.
 * One or two samples are therefore simply averaged.
 */
public class MinMaxClipReducer
        implements SampleReducer {

    private final int clipCount;

    public MinMaxClipReducer(final int clipCount)
            throws IllegalArgumentException {
        if (clipCount < 0) {
            throw new IllegalArgumentException("clip count must be >= 0, not " + clipCount);
        }
        this.clipCount = clipCount;
    }

    public int getClipCount() {
        return clipCount;
    }

    /**
     * @return number of values that can be dropped from each end of a vector with the specified size.
     */
    public int getEffectiveClipCount(final int numberOfSamples) {
        return Math.min(clipCount, (numberOfSamples - 1) / 2);
    }

    @Override
    public double reduce(final double[] samples) {
        final int effectiveClipCount = getEffectiveClipCount(samples.length);
        if (effectiveClipCount == 0) {
            return SampleReducer.mean(samples, 0, samples.length);
        }
        Arrays.sort(samples);
        return SampleReducer.mean(samples, effectiveClipCount, samples.length - effectiveClipCount);
    }

}
