package org.janelia.calibration;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.calibration.json.JsonUtils;

/**
 * Everything a run did: which files were left out and why, which groups were dropped,
 * and what happened to each retained group.
 */
public class RunOutcome
        implements Serializable {

    private final String runStartTime;
    private RunStatus status;
    private final List<FileFailure> readFailures;
    private final List<FileFailure> exclusions;
    private final List<DroppedGroup> droppedGroups;
    private final List<GroupOutcome> groupOutcomes;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private RunOutcome() {
        this(null);
    }

    public RunOutcome(final String runStartTime) {
        this.runStartTime = runStartTime;
        this.status = RunStatus.COMPLETED;
        this.readFailures = new ArrayList<>();
        this.exclusions = new ArrayList<>();
        this.droppedGroups = new ArrayList<>();
        this.groupOutcomes = new ArrayList<>();
    }

    public String getRunStartTime() {
        return runStartTime;
    }

    public RunStatus getStatus() {
        return status;
    }

    public List<FileFailure> getReadFailures() {
        return readFailures;
    }

    public List<FileFailure> getExclusions() {
        return exclusions;
    }

    public List<DroppedGroup> getDroppedGroups() {
        return droppedGroups;
    }

    public int getDroppedFrameCount() {
        return droppedGroups.stream().mapToInt(DroppedGroup::getFrameCount).sum();
    }

    public List<GroupOutcome> getGroupOutcomes() {
        return groupOutcomes;
    }

    public long getGroupCount(final GroupStatus groupStatus) {
        return groupOutcomes.stream().filter(go -> go.getStatus() == groupStatus).count();
    }

    /**
     * @return true if the run completed and every retained group was written.
     */
    public boolean isSuccessful() {
        return (status == RunStatus.COMPLETED) && (getGroupCount(GroupStatus.WRITTEN) == groupOutcomes.size());
    }

    void setStatus(final RunStatus status) {
        this.status = status;
    }

    void addReadFailure(final Path path,
                        final MasterFrameException failure) {
        readFailures.add(new FileFailure(path, failure.getFailureType(), failure.getMessage()));
    }

    void addExclusion(final Path path,
                      final String reason) {
        exclusions.add(new FileFailure(path, null, reason));
    }

    void addDroppedGroup(final DroppedGroup droppedGroup) {
        droppedGroups.add(droppedGroup);
    }

    void addGroupOutcome(final GroupOutcome groupOutcome) {
        groupOutcomes.add(groupOutcome);
    }

    /**
     * @return one line summary suitable for logging.
     */
    public String getSummary() {
        return status + ": " + getGroupCount(GroupStatus.WRITTEN) + " of " + groupOutcomes.size() +
               " groups written, " + getGroupCount(GroupStatus.FAILED) + " failed, " +
               getGroupCount(GroupStatus.CANCELLED) + " cancelled, " + readFailures.size() + " unreadable files, " +
               exclusions.size() + " excluded files, " + droppedGroups.size() + " dropped groups with " +
               getDroppedFrameCount() + " frames";
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static RunOutcome fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    @Override
    public String toString() {
        return getSummary();
    }

    private static final JsonUtils.Helper<RunOutcome> JSON_HELPER = new JsonUtils.Helper<>(RunOutcome.class);
}
