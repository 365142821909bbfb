package org.janelia.calibration.combine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.calibration.DimensionMismatchException;
import org.janelia.calibration.frame.FramePixels;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FrameCombiner} class.
 */
public class FrameCombinerTest {

    @Test
    public void testIdenticalFramesCombineToThemselves() throws Exception {

        final double[] samples = { 100, 101, 99, 250, 0, 65535 };

        final List<FramePixels> stack = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            stack.add(new FramePixels(3, 2, samples.clone()));
        }

        final List<CombineConfig> configs = Arrays.asList(CombineConfig.mean(),
                                                          CombineConfig.median(),
                                                          CombineConfig.minMaxClip(2),
                                                          CombineConfig.sigmaClip(3.0));
        for (final CombineConfig config : configs) {
            final FramePixels combined = new FrameCombiner(config).combine(stack);
            Assert.assertEquals("invalid result for " + config,
                                Arrays.toString(samples), Arrays.toString(combined.getSamples()));
        }
    }

    @Test
    public void testPerPixelReduction() throws Exception {

        final List<FramePixels> stack = Arrays.asList(new FramePixels(2, 1, new double[] { 1, 10 }),
                                                      new FramePixels(2, 1, new double[] { 2, 10 }),
                                                      new FramePixels(2, 1, new double[] { 3, 10 }),
                                                      new FramePixels(2, 1, new double[] { 4, 10 }),
                                                      new FramePixels(2, 1, new double[] { 100, 40 }));

        final FramePixels median = new FrameCombiner(CombineConfig.median()).combine(stack);
        Assert.assertEquals("invalid median for pixel 0", 3.0, median.get(0, 0), 0.0);
        Assert.assertEquals("invalid median for pixel 1", 10.0, median.get(1, 0), 0.0);

        final FramePixels mean = new FrameCombiner(CombineConfig.mean()).combine(stack);
        Assert.assertEquals("invalid mean for pixel 0", 22.0, mean.get(0, 0), 0.0);
        Assert.assertEquals("invalid mean for pixel 1", 16.0, mean.get(1, 0), 0.0);

        Assert.assertEquals("source pixels should not be modified", 100.0, stack.get(4).get(0, 0), 0.0);
    }

    @Test
    public void testSingleFrame() throws Exception {
        final FramePixels pixels = new FramePixels(2, 2, new double[] { 1, 2, 3, 4 });
        final FramePixels combined = new FrameCombiner(CombineConfig.minMaxClip(2)).combine(List.of(pixels));
        Assert.assertEquals("single frame should combine to itself",
                            Arrays.toString(pixels.getSamples()), Arrays.toString(combined.getSamples()));
    }

    @Test(expected = DimensionMismatchException.class)
    public void testDimensionMismatch() throws Exception {
        new FrameCombiner(CombineConfig.mean()).combine(Arrays.asList(new FramePixels(2, 2),
                                                                      new FramePixels(2, 3)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyStack() throws Exception {
        new FrameCombiner(CombineConfig.mean()).combine(new ArrayList<>());
    }
}
