package org.janelia.calibration;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * An input file that was left out of a run, either because it could not be read
 * or because its type or filter made it unsuitable.
 */
public class FileFailure
        implements Serializable {

    private final String path;
    private final FailureType failureType;
    private final String message;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FileFailure() {
        this((String) null, null, null);
    }

    /**
     * @param  path         excluded file.
     * @param  failureType  read failure type, or null for selection exclusions.
     * @param  message      reason the file was left out.
     */
    public FileFailure(final Path path,
                       final FailureType failureType,
                       final String message) {
        this(path == null ? null : path.toString(), failureType, message);
    }

    private FileFailure(final String path,
                        final FailureType failureType,
                        final String message) {
        this.path = path;
        this.failureType = failureType;
        this.message = message;
    }

    public String getPath() {
        return path;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return path + (failureType == null ? "" : " (" + failureType + ")") + ": " + message;
    }
}
