package org.janelia.calibration.precalibration;

/**
 * Adjustment applied to each input frame before combination.
 */
public enum PrecalibrationMode {

    /** Frames are combined as read. */
    NONE,

    /** A constant value is subtracted from every sample. */
    PEDESTAL,

    /** A previously combined bias frame is subtracted sample by sample. */
    BIAS_FRAME
}
