package org.janelia.calibration;

/**
 * Processing status of one retained group.
 */
public enum GroupStatus {
    WRITTEN,
    FAILED,
    CANCELLED
}
