package org.janelia.calibration;

import java.io.Serializable;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.group.FrameGroup;

/**
 * Summary of a group that was too small to combine.
 */
public class DroppedGroup
        implements Serializable {

    private final String key;
    private final List<String> sourcePaths;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DroppedGroup() {
        this.key = null;
        this.sourcePaths = null;
    }

    public DroppedGroup(final FrameGroup group) {
        this.key = group.getKeyDescription();
        this.sourcePaths = group.getFrames().stream()
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

    public int getFrameCount() {
        return sourcePaths.size();
    }

    @Override
    public String toString() {
        return key + " with " + getFrameCount() + " frames";
    }
}
