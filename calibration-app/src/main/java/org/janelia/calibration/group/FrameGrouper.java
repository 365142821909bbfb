package org.janelia.calibration.group;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.SizeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions frames into disjoint groups that can be combined.
 *
 * Frames with different dimensions or binning never share a group, even when size grouping is off.
 * Temperature clustering is greedy and depends on input order: each frame joins the first
 * existing cluster whose running mean temperature is within the bandwidth, or starts a new cluster.
 * Frames without a temperature only cluster with each other.
 */
public class FrameGrouper {

    private final GroupingConfig config;

    public FrameGrouper(final GroupingConfig config) {
        this.config = config;
    }

    /**
     * @param  frames  candidate frames in discovery order.
     *
     * @return retained and dropped groups, both in discovery order.
     */
    public GroupingResult group(final List<Frame> frames) {

        final Map<SizeKey, List<Frame>> sizePartitions = new LinkedHashMap<>();
        for (final Frame frame : frames) {
            sizePartitions.computeIfAbsent(frame.getSizeKey(), k -> new ArrayList<>()).add(frame);
        }

        if ((! config.isGroupBySize()) && (sizePartitions.size() > 1)) {
            LOG.warn("group: frames have {} different sizes, each size will be combined separately",
                     sizePartitions.size());
        }

        final List<FrameGroup> groups = new ArrayList<>();
        final List<FrameGroup> droppedGroups = new ArrayList<>();

        for (final Map.Entry<SizeKey, List<Frame>> entry : sizePartitions.entrySet()) {

            final List<FrameGroup> partitionGroups;
            if (config.isGroupByTemperature()) {
                partitionGroups = clusterByTemperature(entry.getKey(), entry.getValue());
            } else {
                final FrameGroup sizeGroup = new FrameGroup(entry.getKey(), false);
                entry.getValue().forEach(sizeGroup::add);
                partitionGroups = List.of(sizeGroup);
            }

            for (final FrameGroup group : partitionGroups) {
                if (group.size() < config.getMinimumGroupSize()) {
                    LOG.info("group: dropping group of {}, minimum size is {}", group, config.getMinimumGroupSize());
                    droppedGroups.add(group);
                } else {
                    groups.add(group);
                }
            }
        }

        final GroupingResult result = new GroupingResult(groups, droppedGroups);

        LOG.info("group: exit, {} frames formed {}", frames.size(), result);

        return result;
    }

    private List<FrameGroup> clusterByTemperature(final SizeKey sizeKey,
                                                  final List<Frame> partition) {

        final double bandwidth = config.getTemperatureBandwidth();
        final List<FrameGroup> clusters = new ArrayList<>();
        FrameGroup unknownTemperatureCluster = null;

        for (final Frame frame : partition) {

            if (! frame.hasTemperature()) {
                if (unknownTemperatureCluster == null) {
                    unknownTemperatureCluster = new FrameGroup(sizeKey, true);
                    clusters.add(unknownTemperatureCluster);
                }
                unknownTemperatureCluster.add(frame);
                continue;
            }

            FrameGroup matchingCluster = null;
            for (final FrameGroup cluster : clusters) {
                if (cluster.isWithinBandwidth(frame.getTemperature(), bandwidth)) {
                    matchingCluster = cluster;
                    break;
                }
            }

            if (matchingCluster == null) {
                matchingCluster = new FrameGroup(sizeKey, true);
                clusters.add(matchingCluster);
            }

            matchingCluster.add(frame);
        }

        return clusters;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameGrouper.class);
}
