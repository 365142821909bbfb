package org.janelia.calibration.disposition;

/**
 * What happens to a group's input files after its master frame has been written.
 */
public enum DispositionMode {
    LEAVE_IN_PLACE,
    MOVE_TO_SUBFOLDER
}
