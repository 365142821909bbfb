package org.janelia.calibration.frame;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Header attributes of one input image.
 * Pixel data is not held here, it is loaded on demand through a {@link FrameReader}.
 */
public class Frame
        implements Serializable {

    private final Path path;
    private final SizeKey sizeKey;
    private final Double temperature;
    private final Double exposure;
    private final FrameType type;
    private final String filterName;
    private final int bitsPerPixel;

    /**
     * @param  path          location of the frame's file.
     * @param  sizeKey       dimensions and binning.
     * @param  temperature   sensor temperature in degrees (null if unknown).
     * @param  exposure      exposure in seconds (null if unknown).
     * @param  type          acquisition type.
     * @param  filterName    filter name (null if unknown).
     * @param  bitsPerPixel  FITS BITPIX value describing the stored samples.
     */
    public Frame(final Path path,
                 final SizeKey sizeKey,
                 final Double temperature,
                 final Double exposure,
                 final FrameType type,
                 final String filterName,
                 final int bitsPerPixel) {
        this.path = path;
        this.sizeKey = sizeKey;
        this.temperature = temperature;
        this.exposure = exposure;
        this.type = type;
        this.filterName = filterName;
        this.bitsPerPixel = bitsPerPixel;
    }

    public Path getPath() {
        return path;
    }

    public SizeKey getSizeKey() {
        return sizeKey;
    }

    public int getWidth() {
        return sizeKey.getWidth();
    }

    public int getHeight() {
        return sizeKey.getHeight();
    }

    public boolean hasTemperature() {
        return temperature != null;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Double getExposure() {
        return exposure;
    }

    public FrameType getType() {
        return type;
    }

    public String getFilterName() {
        return filterName;
    }

    public int getBitsPerPixel() {
        return bitsPerPixel;
    }

    @Override
    public String toString() {
        return path.getFileName() + " (" + type + ", " + sizeKey +
               (temperature == null ? "" : ", " + temperature + "C") +
               (filterName == null ? "" : ", filter " + filterName) + ")";
    }
}
