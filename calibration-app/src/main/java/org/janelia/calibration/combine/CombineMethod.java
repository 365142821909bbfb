package org.janelia.calibration.combine;

/**
 * Statistical algorithms for reducing a stack of frames to a master frame.
 */
public enum CombineMethod {

    MEAN("Mean", "Mean"),
    MEDIAN("Median", "Median"),
    MIN_MAX_CLIP("Min-Max Clip", "MinMax"),
    SIGMA_CLIP("Sigma Clip", "Sigma");

    private final String displayName;
    private final String fileNameToken;

    CombineMethod(final String displayName,
                  final String fileNameToken) {
        this.displayName = displayName;
        this.fileNameToken = fileNameToken;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return compact name without spaces, suitable for output file names.
     */
    public String getFileNameToken() {
        return fileNameToken;
    }
}
