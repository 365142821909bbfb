package org.janelia.calibration.combine;

import java.util.List;
import java.util.stream.IntStream;

import org.janelia.calibration.DimensionMismatchException;
import org.janelia.calibration.frame.FramePixels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces a stack of aligned pixel arrays to a single array.
 * Each pixel position is reduced independently, rows are processed in parallel.
 */
public class FrameCombiner {

    private final CombineConfig config;
    private final SampleReducer reducer;

    public FrameCombiner(final CombineConfig config) {
        this.config = config;
        this.reducer = SampleReducer.forConfig(config);
    }

    public CombineConfig getConfig() {
        return config;
    }

    /**
     * @param  stack  pixel arrays to combine (all must have the same dimensions).
     *
     * @return combined pixels.
     *
     * @throws IllegalArgumentException
     *   if the stack is empty.
     *
     * @throws DimensionMismatchException
     *   if any array's dimensions differ from the first array's dimensions.
     */
    public FramePixels combine(final List<FramePixels> stack)
            throws IllegalArgumentException, DimensionMismatchException {

        if ((stack == null) || stack.isEmpty()) {
            throw new IllegalArgumentException("at least one frame must be provided for combination");
        }

        final FramePixels first = stack.get(0);
        for (int i = 1; i < stack.size(); i++) {
            final FramePixels pixels = stack.get(i);
            if (! first.hasSameDimensions(pixels)) {
                throw new DimensionMismatchException("frame " + i + " has dimensions " + pixels +
                                                     " but frame 0 has dimensions " + first);
            }
        }

        LOG.debug("combine: entry, reducing {} frames of size {} with {}", stack.size(), first, config);

        final int width = first.getWidth();
        final int numberOfFrames = stack.size();
        final double[][] sourceSamples = new double[numberOfFrames][];
        for (int i = 0; i < numberOfFrames; i++) {
            sourceSamples[i] = stack.get(i).getSamples();
        }

        final FramePixels result = new FramePixels(width, first.getHeight());
        final double[] resultSamples = result.getSamples();

        IntStream.range(0, first.getHeight()).parallel().forEach(y -> {
            final double[] vector = new double[numberOfFrames];
            final int rowOffset = y * width;
            for (int x = 0; x < width; x++) {
                final int index = rowOffset + x;
                for (int i = 0; i < numberOfFrames; i++) {
                    vector[i] = sourceSamples[i][index];
                }
                resultSamples[index] = reducer.reduce(vector);
            }
        });

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameCombiner.class);
}
