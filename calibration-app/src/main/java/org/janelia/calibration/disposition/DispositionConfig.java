package org.janelia.calibration.disposition;

import java.io.Serializable;

import org.janelia.calibration.output.NameTemplate;

/**
 * Immutable input file disposition settings.
 */
public class DispositionConfig
        implements Serializable {

    public static final String DEFAULT_SUBFOLDER_TEMPLATE = "originals-%d-%t";

    private final DispositionMode mode;
    private final String subfolderTemplate;

    private DispositionConfig(final DispositionMode mode,
                              final String subfolderTemplate) {
        this.mode = mode;
        this.subfolderTemplate = subfolderTemplate;
    }

    public static DispositionConfig leaveInPlace() {
        return new DispositionConfig(DispositionMode.LEAVE_IN_PLACE, null);
    }

    /**
     * @param  subfolderTemplate  subfolder name template (see {@link NameTemplate}),
     *                            null for {@link #DEFAULT_SUBFOLDER_TEMPLATE}.
     *
     * @throws IllegalArgumentException
     *   if the template is invalid.
     */
    public static DispositionConfig moveToSubfolder(final String subfolderTemplate)
            throws IllegalArgumentException {
        final String template = subfolderTemplate == null ? DEFAULT_SUBFOLDER_TEMPLATE : subfolderTemplate;
        new NameTemplate(template);
        return new DispositionConfig(DispositionMode.MOVE_TO_SUBFOLDER, template);
    }

    public DispositionMode getMode() {
        return mode;
    }

    public String getSubfolderTemplate() {
        return subfolderTemplate;
    }

    @Override
    public String toString() {
        return mode == DispositionMode.LEAVE_IN_PLACE ? "leave in place" : "move to " + subfolderTemplate;
    }
}
