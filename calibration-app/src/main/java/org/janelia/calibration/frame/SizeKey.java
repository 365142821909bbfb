package org.janelia.calibration.frame;

import java.io.Serializable;
import java.util.Objects;

/**
 * Dimensions and binning that must match exactly for frames to be combined.
 */
public class SizeKey
        implements Serializable {

    private final int width;
    private final int height;
    private final int xBinning;
    private final int yBinning;

    public SizeKey(final int width,
                   final int height,
                   final int xBinning,
                   final int yBinning) {
        this.width = width;
        this.height = height;
        this.xBinning = xBinning;
        this.yBinning = yBinning;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getXBinning() {
        return xBinning;
    }

    public int getYBinning() {
        return yBinning;
    }

    /**
     * @return "WxH" dimension string (e.g. "4096x4096").
     */
    public String getDimensionString() {
        return width + "x" + height;
    }

    /**
     * @return "XxY" binning string (e.g. "2x2").
     */
    public String getBinningString() {
        return xBinning + "x" + yBinning;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final SizeKey that = (SizeKey) o;
        return (width == that.width) && (height == that.height) &&
               (xBinning == that.xBinning) && (yBinning == that.yBinning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, xBinning, yBinning);
    }

    @Override
    public String toString() {
        return getDimensionString() + " binned " + getBinningString();
    }
}
