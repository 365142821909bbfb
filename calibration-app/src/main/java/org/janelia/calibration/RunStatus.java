package org.janelia.calibration;

/**
 * Overall status of a run.
 */
public enum RunStatus {

    /** Every retained group was processed (individual groups may still have failed). */
    COMPLETED,

    /** Cancellation was requested before every group started. */
    CANCELLED,

    /** No readable, selectable input frames were found. */
    EMPTY_INPUT,

    /** Every group was smaller than the minimum group size. */
    NO_GROUPS_SURVIVED;

    public boolean isFatal() {
        return (this == EMPTY_INPUT) || (this == NO_GROUPS_SURVIVED);
    }

    /**
     * @return failure type for fatal statuses, null otherwise.
     */
    public FailureType getFailureType() {
        final FailureType failureType;
        if (this == EMPTY_INPUT) {
            failureType = FailureType.EMPTY_INPUT;
        } else if (this == NO_GROUPS_SURVIVED) {
            failureType = FailureType.NO_GROUPS_SURVIVED;
        } else {
            failureType = null;
        }
        return failureType;
    }
}
