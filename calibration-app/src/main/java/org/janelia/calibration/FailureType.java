package org.janelia.calibration;

/**
 * Categories of failure reported by a master frame run.
 *
 * The first five are raised for individual files or groups and do not stop the run.
 * {@link #EMPTY_INPUT} and {@link #NO_GROUPS_SURVIVED} are fatal run outcomes.
 */
public enum FailureType {

    UNREADABLE_FILE,
    INCOMPLETE_METADATA,
    DIMENSION_MISMATCH,
    WRITE_CONFLICT,
    IO_FAILURE,
    EMPTY_INPUT,
    NO_GROUPS_SURVIVED

}
