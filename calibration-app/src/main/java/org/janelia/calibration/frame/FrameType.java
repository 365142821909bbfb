package org.janelia.calibration.frame;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Acquisition type of a calibration or science frame.
 */
public enum FrameType {

    BIAS,
    DARK,
    FLAT,
    LIGHT,
    UNKNOWN;

    /**
     * @param  imageType  value of an IMAGETYP header card (e.g. "Bias Frame").
     *
     * @return type matching the header value, or {@link #UNKNOWN}.
     */
    public static FrameType fromHeaderValue(final String imageType) {
        FrameType type = UNKNOWN;
        if (imageType != null) {
            final String upperCaseType = imageType.toUpperCase(Locale.ROOT);
            if (upperCaseType.contains("BIAS")) {
                type = BIAS;
            } else if (upperCaseType.contains("DARK")) {
                type = DARK;
            } else if (upperCaseType.contains("FLAT")) {
                type = FLAT;
            } else if (upperCaseType.contains("LIGHT")) {
                type = LIGHT;
            }
        }
        return type;
    }

    /**
     * Guesses a type from telltale words in a file name.
     * Used when a file has no IMAGETYP header card.
     *
     * @param  fileName  name of the file (with or without directory).
     *
     * @return best guess for the type, or {@link #UNKNOWN}.
     */
    public static FrameType fromFileName(final String fileName) {
        final String upperCaseName = fileName.toUpperCase(Locale.ROOT);
        FrameType type = UNKNOWN;
        if (upperCaseName.contains("BIAS")) {
            type = BIAS;
        } else if (upperCaseName.contains("DARK")) {
            type = DARK;
        } else if (upperCaseName.contains("FLAT")) {
            type = FLAT;
        } else {
            for (final String keyword : LIGHT_KEYWORDS) {
                if (upperCaseName.contains(keyword)) {
                    type = LIGHT;
                    break;
                }
            }
        }
        return type;
    }

    private static final List<String> LIGHT_KEYWORDS = Arrays.asList("LIGHT", "LUM", "RED", "GREEN", "BLUE", "HA");
}
