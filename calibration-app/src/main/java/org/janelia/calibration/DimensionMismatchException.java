package org.janelia.calibration;

/**
 * This exception is thrown when pixel arrays that must be aligned have different dimensions.
 */
public class DimensionMismatchException
        extends MasterFrameException {

    public DimensionMismatchException(final String message) {
        super(FailureType.DIMENSION_MISMATCH, message);
    }

    public DimensionMismatchException(final String message,
                                      final Throwable cause) {
        super(FailureType.DIMENSION_MISMATCH, message, cause);
    }
}
