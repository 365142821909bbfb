package org.janelia.calibration.disposition;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Result of moving (or trying to move) one input file.
 */
public class FileDisposition
        implements Serializable {

    private final String sourcePath;
    private final String targetPath;
    private final boolean moved;
    private final String failureMessage;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FileDisposition() {
        this(null, null, false, null);
    }

    private FileDisposition(final String sourcePath,
                            final String targetPath,
                            final boolean moved,
                            final String failureMessage) {
        this.sourcePath = sourcePath;
        this.targetPath = targetPath;
        this.moved = moved;
        this.failureMessage = failureMessage;
    }

    public static FileDisposition moved(final Path sourcePath,
                                        final Path targetPath) {
        return new FileDisposition(sourcePath.toString(), targetPath.toString(), true, null);
    }

    public static FileDisposition failed(final Path sourcePath,
                                         final Path targetPath,
                                         final String failureMessage) {
        return new FileDisposition(sourcePath.toString(), targetPath.toString(), false, failureMessage);
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public String getTargetPath() {
        return targetPath;
    }

    public boolean isMoved() {
        return moved;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    @Override
    public String toString() {
        return moved ? "moved " + sourcePath + " to " + targetPath :
               "failed to move " + sourcePath + " to " + targetPath + ": " + failureMessage;
    }
}
