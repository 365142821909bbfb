package org.janelia.calibration;

/**
 * This exception is thrown when a file cannot be parsed as an image.
 */
public class UnreadableFileException
        extends MasterFrameException {

    public UnreadableFileException(final String message) {
        super(FailureType.UNREADABLE_FILE, message);
    }

    public UnreadableFileException(final String message,
                                   final Throwable cause) {
        super(FailureType.UNREADABLE_FILE, message, cause);
    }
}
