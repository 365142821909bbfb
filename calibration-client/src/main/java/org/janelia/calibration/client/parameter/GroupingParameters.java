package org.janelia.calibration.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.calibration.group.GroupingConfig;

/**
 * Parameters for selecting and grouping input frames.
 */
public class GroupingParameters
        implements Serializable {

    @Parameter(
            names = "--groupBySize",
            description = "Combine frames with different dimensions or binning into separate master frames",
            arity = 0)
    public boolean groupBySize = false;

    @Parameter(
            names = "--groupByTemperature",
            description = "Combine frames with different sensor temperatures into separate master frames",
            arity = 0)
    public boolean groupByTemperature = false;

    @Parameter(
            names = "--temperatureBandwidth",
            description = "Maximum distance (degrees C) between a frame's temperature and " +
                          "its group's mean temperature")
    public Double temperatureBandwidth = GroupingConfig.DEFAULT_TEMPERATURE_BANDWIDTH;

    @Parameter(
            names = "--minimumGroupSize",
            description = "Groups with fewer frames are skipped")
    public Integer minimumGroupSize = 1;

    @Parameter(
            names = "--ignoreType",
            description = "Include frames that are not marked as bias frames",
            arity = 0)
    public boolean ignoreType = false;

    @Parameter(
            names = "--ignoreFilter",
            description = "Include frames whose filter differs from the most common filter",
            arity = 0)
    public boolean ignoreFilter = false;

    /**
     * @throws IllegalArgumentException
     *   if the bandwidth or minimum group size is out of range.
     */
    public GroupingConfig toConfig()
            throws IllegalArgumentException {

        if ((temperatureBandwidth == null) || (! (temperatureBandwidth > 0.0))) {
            throw new IllegalArgumentException("--temperatureBandwidth must be > 0");
        }
        if ((minimumGroupSize == null) || (minimumGroupSize < 1)) {
            throw new IllegalArgumentException("--minimumGroupSize must be > 0");
        }

        return new GroupingConfig(groupBySize,
                                  groupByTemperature,
                                  temperatureBandwidth,
                                  minimumGroupSize,
                                  ignoreType,
                                  ignoreFilter);
    }
}
