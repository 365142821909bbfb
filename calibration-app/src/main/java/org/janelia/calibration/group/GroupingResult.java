package org.janelia.calibration.group;

import java.util.Collections;
import java.util.List;

/**
 * Groups retained for combination along with the groups dropped for being too small.
 */
public class GroupingResult {

    private final List<FrameGroup> groups;
    private final List<FrameGroup> droppedGroups;

    public GroupingResult(final List<FrameGroup> groups,
                          final List<FrameGroup> droppedGroups) {
        this.groups = Collections.unmodifiableList(groups);
        this.droppedGroups = Collections.unmodifiableList(droppedGroups);
    }

    public List<FrameGroup> getGroups() {
        return groups;
    }

    public List<FrameGroup> getDroppedGroups() {
        return droppedGroups;
    }

    public int getDroppedFrameCount() {
        return droppedGroups.stream().mapToInt(FrameGroup::size).sum();
    }

    @Override
    public String toString() {
        return groups.size() + " groups, dropped " + droppedGroups.size() + " groups with " +
               getDroppedFrameCount() + " frames";
    }
}
