package org.janelia.calibration.group;

import java.io.Serializable;

/**
 * Immutable criteria for partitioning candidate frames into combinable groups.
 */
public class GroupingConfig
        implements Serializable {

    public static final double DEFAULT_TEMPERATURE_BANDWIDTH = 1.0;

    private final boolean groupBySize;
    private final boolean groupByTemperature;
    private final double temperatureBandwidth;
    private final int minimumGroupSize;
    private final boolean ignoreType;
    private final boolean ignoreFilter;

    /**
     * @param  groupBySize           partition frames by exact dimensions and binning.
     * @param  groupByTemperature    split size partitions into temperature clusters.
     * @param  temperatureBandwidth  maximum distance (degrees) from a cluster's running mean temperature.
     * @param  minimumGroupSize      groups with fewer frames are dropped.
     * @param  ignoreType            keep frames whose type is not bias.
     * @param  ignoreFilter          keep frames whose filter differs from the most common filter.
     *
     * @throws IllegalArgumentException
     *   if the bandwidth or minimum group size is out of range.
     */
    public GroupingConfig(final boolean groupBySize,
                          final boolean groupByTemperature,
                          final double temperatureBandwidth,
                          final int minimumGroupSize,
                          final boolean ignoreType,
                          final boolean ignoreFilter)
            throws IllegalArgumentException {

        if (groupByTemperature && (! (temperatureBandwidth > 0.0))) {
            throw new IllegalArgumentException("temperature bandwidth must be > 0, not " + temperatureBandwidth);
        }
        if (minimumGroupSize < 1) {
            throw new IllegalArgumentException("minimum group size must be > 0, not " + minimumGroupSize);
        }

        this.groupBySize = groupBySize;
        this.groupByTemperature = groupByTemperature;
        this.temperatureBandwidth = temperatureBandwidth;
        this.minimumGroupSize = minimumGroupSize;
        this.ignoreType = ignoreType;
        this.ignoreFilter = ignoreFilter;
    }

    /**
     * @return configuration that combines all compatible frames into one group.
     */
    public static GroupingConfig combineEverything() {
        return new GroupingConfig(false, false, DEFAULT_TEMPERATURE_BANDWIDTH, 1, false, false);
    }

    public boolean isGroupBySize() {
        return groupBySize;
    }

    public boolean isGroupByTemperature() {
        return groupByTemperature;
    }

    public double getTemperatureBandwidth() {
        return temperatureBandwidth;
    }

    public int getMinimumGroupSize() {
        return minimumGroupSize;
    }

    public boolean isIgnoreType() {
        return ignoreType;
    }

    public boolean isIgnoreFilter() {
        return ignoreFilter;
    }

    /**
     * @return true if either grouping criterion is active.
     */
    public boolean isGrouping() {
        return groupBySize || groupByTemperature;
    }

    @Override
    public String toString() {
        return "{groupBySize: " + groupBySize +
               ", groupByTemperature: " + groupByTemperature +
               ", temperatureBandwidth: " + temperatureBandwidth +
               ", minimumGroupSize: " + minimumGroupSize +
               ", ignoreType: " + ignoreType +
               ", ignoreFilter: " + ignoreFilter + '}';
    }
}
