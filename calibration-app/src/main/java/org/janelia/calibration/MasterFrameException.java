package org.janelia.calibration;

/**
 * This exception class serves as the base class for all recoverable file and group failures.
 */
public abstract class MasterFrameException
        extends Exception {

    private final FailureType failureType;

    public MasterFrameException(final FailureType failureType,
                                final String message) {
        this(failureType, message, null);
    }

    public MasterFrameException(final FailureType failureType,
                                final String message,
                                final Throwable cause) {
        super(message, cause);
        this.failureType = failureType;
    }

    public FailureType getFailureType() {
        return failureType;
    }

}
