package org.janelia.calibration;

/**
 * This exception is thrown when reading or writing the file system fails while producing a group's output.
 */
public class OutputFailureException
        extends MasterFrameException {

    public OutputFailureException(final String message) {
        super(FailureType.IO_FAILURE, message);
    }

    public OutputFailureException(final String message,
                                  final Throwable cause) {
        super(FailureType.IO_FAILURE, message, cause);
    }
}
