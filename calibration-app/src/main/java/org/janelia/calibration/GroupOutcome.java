package org.janelia.calibration;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.calibration.disposition.FileDisposition;
import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.group.FrameGroup;

/**
 * Result of processing one retained group.
 */
public class GroupOutcome
        implements Serializable {

    private final String key;
    private final List<String> sourcePaths;
    private final GroupStatus status;
    private final String outputPath;
    private final FailureType failureType;
    private final String failureMessage;
    private final List<FileDisposition> dispositions;
    private final Long elapsedMilliseconds;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private GroupOutcome() {
        this(null, null, null, null, null, null, null, null);
    }

    private GroupOutcome(final String key,
                         final List<String> sourcePaths,
                         final GroupStatus status,
                         final String outputPath,
                         final FailureType failureType,
                         final String failureMessage,
                         final List<FileDisposition> dispositions,
                         final Long elapsedMilliseconds) {
        this.key = key;
        this.sourcePaths = sourcePaths;
        this.status = status;
        this.outputPath = outputPath;
        this.failureType = failureType;
        this.failureMessage = failureMessage;
        this.dispositions = dispositions;
        this.elapsedMilliseconds = elapsedMilliseconds;
    }

    public static GroupOutcome written(final FrameGroup group,
                                       final Path outputPath,
                                       final List<FileDisposition> dispositions,
                                       final long elapsedMilliseconds) {
        return new GroupOutcome(group.getKeyDescription(),
                                getSourcePaths(group),
                                GroupStatus.WRITTEN,
                                outputPath.toString(),
                                null,
                                null,
                                new ArrayList<>(dispositions),
                                elapsedMilliseconds);
    }

    public static GroupOutcome failed(final FrameGroup group,
                                      final Path outputPath,
                                      final MasterFrameException failure,
                                      final Long elapsedMilliseconds) {
        return new GroupOutcome(group.getKeyDescription(),
                                getSourcePaths(group),
                                GroupStatus.FAILED,
                                outputPath == null ? null : outputPath.toString(),
                                failure.getFailureType(),
                                failure.getMessage(),
                                Collections.emptyList(),
                                elapsedMilliseconds);
    }

    public static GroupOutcome cancelled(final FrameGroup group) {
        return new GroupOutcome(group.getKeyDescription(),
                                getSourcePaths(group),
                                GroupStatus.CANCELLED,
                                null,
                                null,
                                null,
                                Collections.emptyList(),
                                null);
    }

    private static List<String> getSourcePaths(final FrameGroup group) {
        return group.getFrames().stream()
                .map(Frame::getPath)
                .map(Object::toString)
                .collect(Collectors.toList());
    }

    public String getKey() {
        return key;
    }

    public List<String> getSourcePaths() {
        return sourcePaths;
    }

    public GroupStatus getStatus() {
        return status;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public List<FileDisposition> getDispositions() {
        return dispositions;
    }

    public Long getElapsedMilliseconds() {
        return elapsedMilliseconds;
    }

    public boolean isWritten() {
        return status == GroupStatus.WRITTEN;
    }

    @Override
    public String toString() {
        final String description;
        switch (status) {
            case WRITTEN:
                description = key + " written to " + outputPath;
                break;
            case FAILED:
                description = key + " failed (" + failureType + "): " + failureMessage;
                break;
            default:
                description = key + " cancelled";
        }
        return description;
    }
}
