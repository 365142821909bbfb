package org.janelia.calibration.combine;

import java.io.Serializable;

/**
 * Immutable combination algorithm selection with its numeric parameters.
 */
public class CombineConfig
        implements Serializable {

    public static final int DEFAULT_CLIP_COUNT = 2;
    public static final double DEFAULT_SIGMA_THRESHOLD = 3.0;

    private final CombineMethod method;
    private final int clipCount;
    private final double sigmaThreshold;

    /**
     * @param  method          combination algorithm.
     * @param  clipCount       number of lowest and highest samples dropped by {@link CombineMethod#MIN_MAX_CLIP}.
     * @param  sigmaThreshold  rejection distance in standard deviations for {@link CombineMethod#SIGMA_CLIP}.
     *
     * @throws IllegalArgumentException
     *   if the parameter needed by the method is out of range.
     */
    public CombineConfig(final CombineMethod method,
                         final int clipCount,
                         final double sigmaThreshold)
            throws IllegalArgumentException {

        if (method == null) {
            throw new IllegalArgumentException("combine method must be specified");
        }
        if (clipCount < 0) {
            throw new IllegalArgumentException("clip count must be >= 0, not " + clipCount);
        }
        if (! (sigmaThreshold > 0.0)) {
            throw new IllegalArgumentException("sigma threshold must be > 0, not " + sigmaThreshold);
        }

        this.method = method;
        this.clipCount = clipCount;
        this.sigmaThreshold = sigmaThreshold;
    }

    public static CombineConfig mean() {
        return new CombineConfig(CombineMethod.MEAN, DEFAULT_CLIP_COUNT, DEFAULT_SIGMA_THRESHOLD);
    }

    public static CombineConfig median() {
        return new CombineConfig(CombineMethod.MEDIAN, DEFAULT_CLIP_COUNT, DEFAULT_SIGMA_THRESHOLD);
    }

    public static CombineConfig minMaxClip(final int clipCount) {
        return new CombineConfig(CombineMethod.MIN_MAX_CLIP, clipCount, DEFAULT_SIGMA_THRESHOLD);
    }

    public static CombineConfig sigmaClip(final double sigmaThreshold) {
        return new CombineConfig(CombineMethod.SIGMA_CLIP, DEFAULT_CLIP_COUNT, sigmaThreshold);
    }

    public CombineMethod getMethod() {
        return method;
    }

    public int getClipCount() {
        return clipCount;
    }

    public double getSigmaThreshold() {
        return sigmaThreshold;
    }

    /**
     * @return human readable description of the method and the parameter it uses.
     */
    public String getDescription() {
        final String description;
        switch (method) {
            case MIN_MAX_CLIP:
                description = method.getDisplayName() + " (drop " + clipCount + ") Mean";
                break;
            case SIGMA_CLIP:
                description = method.getDisplayName() + " (threshold " + sigmaThreshold + ") Mean";
                break;
            default:
                description = method.getDisplayName();
        }
        return description;
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
