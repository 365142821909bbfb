package org.janelia.calibration.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.FrameType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Excludes candidate frames whose type or filter makes them unsuitable for a master bias.
 */
public class FrameSelector {

    /**
     * Frames kept for grouping and frames excluded along with the reason for each exclusion.
     */
    public static class Selection {

        private final List<Frame> selectedFrames;
        private final List<Frame> excludedFrames;
        private final List<String> exclusionReasons;

        public Selection() {
            this.selectedFrames = new ArrayList<>();
            this.excludedFrames = new ArrayList<>();
            this.exclusionReasons = new ArrayList<>();
        }

        public List<Frame> getSelectedFrames() {
            return Collections.unmodifiableList(selectedFrames);
        }

        public List<Frame> getExcludedFrames() {
            return Collections.unmodifiableList(excludedFrames);
        }

        public String getExclusionReason(final int excludedIndex) {
            return exclusionReasons.get(excludedIndex);
        }

        void exclude(final Frame frame,
                     final String reason) {
            excludedFrames.add(frame);
            exclusionReasons.add(reason);
        }
    }

    private final GroupingConfig config;

    public FrameSelector(final GroupingConfig config) {
        this.config = config;
    }

    /**
     * @param  frames  candidate frames in discovery order.
     *
     * @return selection result (order preserved).
     */
    public Selection select(final List<Frame> frames) {

        final Selection selection = new Selection();
        final List<Frame> typeMatches = new ArrayList<>();

        for (final Frame frame : frames) {
            if (config.isIgnoreType() || (frame.getType() == FrameType.BIAS)) {
                typeMatches.add(frame);
            } else {
                selection.exclude(frame, "frame type is " + frame.getType() + " rather than " + FrameType.BIAS);
            }
        }

        if (config.isIgnoreFilter()) {
            selection.selectedFrames.addAll(typeMatches);
        } else {
            final String expectedFilter = FrameGroup.getMostCommonFilterName(typeMatches);
            for (final Frame frame : typeMatches) {
                if (Objects.equals(expectedFilter, frame.getFilterName())) {
                    selection.selectedFrames.add(frame);
                } else {
                    selection.exclude(frame, "filter " + frame.getFilterName() +
                                             " differs from most common filter " + expectedFilter);
                }
            }
        }

        if (selection.excludedFrames.size() > 0) {
            LOG.info("select: excluded {} of {} frames", selection.excludedFrames.size(), frames.size());
        }

        return selection;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameSelector.class);
}
