package org.janelia.calibration;

/**
 * This exception is thrown when an output path was already produced by an earlier group in the same run.
 */
public class WriteConflictException
        extends MasterFrameException {

    public WriteConflictException(final String message) {
        super(FailureType.WRITE_CONFLICT, message);
    }

    public WriteConflictException(final String message,
                                  final Throwable cause) {
        super(FailureType.WRITE_CONFLICT, message, cause);
    }
}
