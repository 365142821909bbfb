package org.janelia.calibration.combine;

/**
 * Mean of the samples within sigma threshold (population) standard deviations of the mean.
 *
 * Identical samples have a zero standard deviation, so nothing is rejected.
 * If every sample is rejected, the unfiltered mean is returned.
 */
public class SigmaClipReducer
        implements SampleReducer {

    private final double sigmaThreshold;

    public SigmaClipReducer(final double sigmaThreshold)
            throws IllegalArgumentException {
        if (! (sigmaThreshold > 0.0)) {
            throw new IllegalArgumentException("sigma threshold must be > 0, not " + sigmaThreshold);
        }
        this.sigmaThreshold = sigmaThreshold;
    }

    @Override
    public double reduce(final double[] samples) {

        final double mean = SampleReducer.mean(samples, 0, samples.length);

        double sumOfSquaredDifferences = 0.0;
        for (final double sample : samples) {
            final double difference = sample - mean;
            sumOfSquaredDifferences += difference * difference;
        }
        final double maxDistance = sigmaThreshold * Math.sqrt(sumOfSquaredDifferences / samples.length);

        double keptSum = 0.0;
        int keptCount = 0;
        for (final double sample : samples) {
            if (Math.abs(sample - mean) <= maxDistance) {
                keptSum += sample;
                keptCount++;
            }
        }

        return keptCount == 0 ? mean : keptSum / keptCount;
    }

}
