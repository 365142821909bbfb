package org.janelia.calibration.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.SizeKey;

/**
 * Ordered set of frames that share a size key and (optionally) a temperature cluster.
 */
public class FrameGroup {

    private final SizeKey sizeKey;
    private final boolean temperatureClustered;
    private final List<Frame> frames;

    private double temperatureSum;
    private int temperatureCount;

    /**
     * @param  sizeKey               key shared by every member.
     * @param  temperatureClustered  true if members were admitted by temperature.
     */
    public FrameGroup(final SizeKey sizeKey,
                      final boolean temperatureClustered) {
        this.sizeKey = sizeKey;
        this.temperatureClustered = temperatureClustered;
        this.frames = new ArrayList<>();
        this.temperatureSum = 0.0;
        this.temperatureCount = 0;
    }

    /**
     * Appends a frame to this group, updating the running mean temperature.
     *
     * @throws IllegalArgumentException
     *   if the frame's size key differs from this group's key.
     */
    public void add(final Frame frame)
            throws IllegalArgumentException {
        if (! sizeKey.equals(frame.getSizeKey())) {
            throw new IllegalArgumentException("cannot add " + frame + " to group with size " + sizeKey);
        }
        frames.add(frame);
        if (frame.hasTemperature()) {
            temperatureSum += frame.getTemperature();
            temperatureCount++;
        }
    }

    public SizeKey getSizeKey() {
        return sizeKey;
    }

    public boolean isTemperatureClustered() {
        return temperatureClustered;
    }

    public List<Frame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public int size() {
        return frames.size();
    }

    /**
     * @return running mean temperature of members with a known temperature, or null if there are none.
     */
    public Double getMeanTemperature() {
        return temperatureCount == 0 ? null : temperatureSum / temperatureCount;
    }

    /**
     * @return mean exposure of members with a known exposure, or null if there are none.
     */
    public Double getMeanExposure() {
        double sum = 0.0;
        int count = 0;
        for (final Frame frame : frames) {
            if (frame.getExposure() != null) {
                sum += frame.getExposure();
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    /**
     * @return true if the specified temperature is within bandwidth degrees of this group's running mean.
     */
    public boolean isWithinBandwidth(final double temperature,
                                     final double bandwidth) {
        final Double meanTemperature = getMeanTemperature();
        return (meanTemperature != null) && (Math.abs(temperature - meanTemperature) <= bandwidth);
    }

    /**
     * @return filter name shared by the most members (ties go to the earliest member), possibly null.
     */
    public String getMostCommonFilterName() {
        return getMostCommonFilterName(frames);
    }

    public static String getMostCommonFilterName(final List<Frame> frameList) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final Frame frame : frameList) {
            counts.merge(frame.getFilterName(), 1, Integer::sum);
        }
        String mostCommon = null;
        int maxCount = 0;
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > maxCount) {
                mostCommon = entry.getKey();
                maxCount = entry.getValue();
            }
        }
        return mostCommon;
    }

    /**
     * @return description of the group key (e.g. "4096x4096 binned 1x1 near -10.2C").
     */
    public String getKeyDescription() {
        final StringBuilder sb = new StringBuilder(sizeKey.toString());
        if (temperatureClustered) {
            final Double meanTemperature = getMeanTemperature();
            if (meanTemperature == null) {
                sb.append(" at unknown temperature");
            } else {
                sb.append(String.format(Locale.ROOT, " near %.1fC", meanTemperature));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return frames.size() + " frames sized " + getKeyDescription();
    }
}
