package org.janelia.calibration;

/**
 * This exception is thrown when a file's header is missing required dimension information.
 */
public class IncompleteMetadataException
        extends MasterFrameException {

    public IncompleteMetadataException(final String message) {
        super(FailureType.INCOMPLETE_METADATA, message);
    }

    public IncompleteMetadataException(final String message,
                                       final Throwable cause) {
        super(FailureType.INCOMPLETE_METADATA, message, cause);
    }
}
