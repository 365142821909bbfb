package org.janelia.calibration.frame;

/**
 * Row-major grid of real valued samples.
 */
public class FramePixels {

    private final int width;
    private final int height;
    private final double[] samples;

    public FramePixels(final int width,
                       final int height) {
        this(width, height, new double[width * height]);
    }

    public FramePixels(final int width,
                       final int height,
                       final double[] samples)
            throws IllegalArgumentException {

        if (samples.length != (width * height)) {
            throw new IllegalArgumentException(samples.length + " samples do not fill a " +
                                               width + "x" + height + " grid");
        }

        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double get(final int x,
                      final int y) {
        return samples[(y * width) + x];
    }

    public void set(final int x,
                    final int y,
                    final double value) {
        samples[(y * width) + x] = value;
    }

    /**
     * @return the backing sample array (not a copy).
     */
    public double[] getSamples() {
        return samples;
    }

    public boolean hasSameDimensions(final FramePixels that) {
        return (width == that.width) && (height == that.height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
