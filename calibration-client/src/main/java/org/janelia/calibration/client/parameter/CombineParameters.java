package org.janelia.calibration.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.Locale;

import org.janelia.calibration.combine.CombineConfig;
import org.janelia.calibration.combine.CombineMethod;

/**
 * Parameters for selecting the combination algorithm.
 */
public class CombineParameters
        implements Serializable {

    @Parameter(
            names = "--method",
            description = "Combination method: mean, median, minmax (drop extremes then mean), " +
                          "or sigma (drop outliers then mean)")
    public String method = "mean";

    @Parameter(
            names = "--clipCount",
            description = "Number of lowest and highest samples dropped for each pixel by the minmax method")
    public Integer clipCount = CombineConfig.DEFAULT_CLIP_COUNT;

    @Parameter(
            names = "--sigmaThreshold",
            description = "Samples farther than this many standard deviations from the mean " +
                          "are dropped by the sigma method")
    public Double sigmaThreshold = CombineConfig.DEFAULT_SIGMA_THRESHOLD;

    public CombineMethod getMethod()
            throws IllegalArgumentException {

        final String normalizedMethod = method == null ? "" : method.trim().toLowerCase(Locale.ROOT);

        final CombineMethod combineMethod;
        switch (normalizedMethod) {
            case "mean":
                combineMethod = CombineMethod.MEAN;
                break;
            case "median":
                combineMethod = CombineMethod.MEDIAN;
                break;
            case "minmax":
            case "min_max_clip":
                combineMethod = CombineMethod.MIN_MAX_CLIP;
                break;
            case "sigma":
            case "sigma_clip":
                combineMethod = CombineMethod.SIGMA_CLIP;
                break;
            default:
                throw new IllegalArgumentException("--method must be mean, median, minmax, or sigma, not '" +
                                                   method + "'");
        }

        return combineMethod;
    }

    /**
     * @throws IllegalArgumentException
     *   if the method is unknown or the clip count or sigma threshold is out of range.
     */
    public CombineConfig toConfig()
            throws IllegalArgumentException {

        if ((clipCount == null) || (clipCount < 0)) {
            throw new IllegalArgumentException("--clipCount must be >= 0");
        }
        if ((sigmaThreshold == null) || (! (sigmaThreshold > 0.0))) {
            throw new IllegalArgumentException("--sigmaThreshold must be > 0");
        }

        return new CombineConfig(getMethod(), clipCount, sigmaThreshold);
    }
}
