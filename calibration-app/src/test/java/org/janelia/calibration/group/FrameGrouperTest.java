package org.janelia.calibration.group;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.FrameType;
import org.janelia.calibration.frame.SizeKey;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FrameGrouper} class.
 */
public class FrameGrouperTest {

    @Test
    public void testEmptyInput() {
        final GroupingResult result = new FrameGrouper(GroupingConfig.combineEverything()).group(new ArrayList<>());
        Assert.assertEquals("empty input should produce no groups", 0, result.getGroups().size());
        Assert.assertEquals("empty input should drop nothing", 0, result.getDroppedFrameCount());
    }

    @Test
    public void testGroupBySize() {

        final List<Frame> frames = Arrays.asList(buildFrame("a", 1, null),
                                                 buildFrame("b", 1, null),
                                                 buildFrame("c", 2, null));

        final GroupingResult result = new FrameGrouper(config(true, false, 1.0, 1)).group(frames);

        Assert.assertEquals("invalid number of groups", 2, result.getGroups().size());
        Assert.assertEquals("invalid size for first group", 2, result.getGroups().get(0).size());
        Assert.assertEquals("invalid binning for second group",
                            2, result.getGroups().get(1).getSizeKey().getXBinning());
    }

    @Test
    public void testWithoutGroupingKeepsSizesApart() {

        final List<Frame> frames = Arrays.asList(buildFrame("a", 1, -10.0),
                                                 buildFrame("b", 2, 5.0),
                                                 buildFrame("c", 1, 20.0));

        final GroupingResult result = new FrameGrouper(GroupingConfig.combineEverything()).group(frames);

        Assert.assertEquals("mismatched sizes should be split", 2, result.getGroups().size());
        Assert.assertEquals("temperatures should be ignored", 2, result.getGroups().get(0).size());
        Assert.assertEquals("invalid member order",
                            Path.of("c.fit"), result.getGroups().get(0).getFrames().get(1).getPath());
    }

    @Test
    public void testGroupByTemperature() {

        final List<Frame> frames = Arrays.asList(buildFrame("a", 1, -10.0),
                                                 buildFrame("b", 1, -10.3),
                                                 buildFrame("c", 1, -9.8),
                                                 buildFrame("d", 1, 5.0));

        GroupingResult result = new FrameGrouper(config(false, true, 1.0, 1)).group(frames);

        Assert.assertEquals("invalid number of groups", 2, result.getGroups().size());
        Assert.assertEquals("invalid size for first group", 3, result.getGroups().get(0).size());
        Assert.assertEquals("invalid size for second group", 1, result.getGroups().get(1).size());
        Assert.assertEquals("invalid mean temperature for first group",
                            -10.033, result.getGroups().get(0).getMeanTemperature(), 0.001);

        result = new FrameGrouper(config(false, true, 1.0, 2)).group(frames);

        Assert.assertEquals("singleton should be dropped", 1, result.getGroups().size());
        Assert.assertEquals("invalid number of dropped groups", 1, result.getDroppedGroups().size());
        Assert.assertEquals("invalid dropped frame count", 1, result.getDroppedFrameCount());
        Assert.assertEquals("invalid dropped frame",
                            Path.of("d.fit"), result.getDroppedGroups().get(0).getFrames().get(0).getPath());
    }

    @Test
    public void testTemperatureClusteringUsesRunningMean() {

        // -10.0 and -9.2 average to -9.6, so -8.7 is within 1.0 of the running mean
        // even though it is 1.3 away from the first frame
        final List<Frame> frames = Arrays.asList(buildFrame("a", 1, -10.0),
                                                 buildFrame("b", 1, -9.2),
                                                 buildFrame("c", 1, -8.7));

        final GroupingResult result = new FrameGrouper(config(false, true, 1.0, 1)).group(frames);

        Assert.assertEquals("invalid number of groups", 1, result.getGroups().size());
    }

    @Test
    public void testUnknownTemperaturesClusterTogether() {

        final List<Frame> frames = Arrays.asList(buildFrame("a", 1, null),
                                                 buildFrame("b", 1, -10.0),
                                                 buildFrame("c", 1, null));

        final GroupingResult result = new FrameGrouper(config(true, true, 1.0, 1)).group(frames);

        Assert.assertEquals("invalid number of groups", 2, result.getGroups().size());
        final FrameGroup unknownGroup = result.getGroups().get(0);
        Assert.assertEquals("invalid unknown temperature group size", 2, unknownGroup.size());
        Assert.assertNull("unknown temperature group should not have a mean", unknownGroup.getMeanTemperature());
    }

    @Test
    public void testPartitionsAreDisjointAndComplete() {

        final List<Frame> frames = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            frames.add(buildFrame("f" + i, 1 + (i % 2), -10.0 + (i % 5)));
        }

        final GroupingResult result = new FrameGrouper(config(true, true, 0.5, 3)).group(frames);

        final List<Frame> grouped = new ArrayList<>();
        result.getGroups().forEach(g -> grouped.addAll(g.getFrames()));
        result.getDroppedGroups().forEach(g -> grouped.addAll(g.getFrames()));

        Assert.assertEquals("every frame should be in exactly one group", frames.size(), grouped.size());
        Assert.assertTrue("every frame should be grouped", grouped.containsAll(frames));

        for (final FrameGroup group : result.getGroups()) {
            Assert.assertTrue("group " + group + " is too small", group.size() >= 3);
            for (final Frame frame : group.getFrames()) {
                Assert.assertEquals("invalid size key in group " + group, group.getSizeKey(), frame.getSizeKey());
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBandwidth() {
        config(false, true, 0.0, 1);
    }

    private static GroupingConfig config(final boolean groupBySize,
                                         final boolean groupByTemperature,
                                         final double bandwidth,
                                         final int minimumGroupSize) {
        return new GroupingConfig(groupBySize, groupByTemperature, bandwidth, minimumGroupSize, false, false);
    }

    static Frame buildFrame(final String name,
                            final int binning,
                            final Double temperature) {
        return new Frame(Path.of(name + ".fit"),
                         new SizeKey(10, 8, binning, binning),
                         temperature,
                         0.0,
                         FrameType.BIAS,
                         null,
                         16);
    }
}
