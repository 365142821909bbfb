package org.janelia.calibration.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.calibration.disposition.DispositionConfig;

/**
 * Parameters for handling input files after their master frame is written.
 */
public class DispositionParameters
        implements Serializable {

    @Parameter(
            names = "--moveInputsTo",
            description = "Move each group's input files into a subfolder with this name template " +
                          "(e.g. " + DispositionConfig.DEFAULT_SUBFOLDER_TEMPLATE + ") " +
                          "created in the inputs' common parent directory.  " +
                          "Omit to leave input files in place.")
    public String moveInputsTo;

    public DispositionConfig toConfig()
            throws IllegalArgumentException {
        return moveInputsTo == null ?
               DispositionConfig.leaveInPlace() : DispositionConfig.moveToSubfolder(moveInputsTo);
    }
}
