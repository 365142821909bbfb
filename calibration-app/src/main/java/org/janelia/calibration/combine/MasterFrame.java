package org.janelia.calibration.combine;

import org.janelia.calibration.frame.FramePixels;
import org.janelia.calibration.frame.SizeKey;

/**
 * Combined result for one group of frames along with the metadata recorded in its output file.
 */
public class MasterFrame {

    private final FramePixels pixels;
    private final CombineConfig combineConfig;
    private final int sourceCount;
    private final SizeKey sizeKey;
    private final String filterName;
    private final Double meanTemperature;
    private final Double meanExposure;
    private final String precalibrationDescription;
    private final boolean doublePrecision;

    /**
     * @param  pixels                     combined pixels.
     * @param  combineConfig              algorithm used to combine the sources.
     * @param  sourceCount                number of combined source frames.
     * @param  sizeKey                    dimensions and binning shared by the sources.
     * @param  filterName                 most common source filter name (null if unknown).
     * @param  meanTemperature            mean source temperature (null if unknown).
     * @param  meanExposure               mean source exposure (null if unknown).
     * @param  precalibrationDescription  description of any precalibration applied to the sources.
     * @param  doublePrecision            true if samples should be stored with 64 bit precision.
     */
    public MasterFrame(final FramePixels pixels,
                       final CombineConfig combineConfig,
                       final int sourceCount,
                       final SizeKey sizeKey,
                       final String filterName,
                       final Double meanTemperature,
                       final Double meanExposure,
                       final String precalibrationDescription,
                       final boolean doublePrecision) {
        this.pixels = pixels;
        this.combineConfig = combineConfig;
        this.sourceCount = sourceCount;
        this.sizeKey = sizeKey;
        this.filterName = filterName;
        this.meanTemperature = meanTemperature;
        this.meanExposure = meanExposure;
        this.precalibrationDescription = precalibrationDescription;
        this.doublePrecision = doublePrecision;
    }

    public FramePixels getPixels() {
        return pixels;
    }

    public CombineConfig getCombineConfig() {
        return combineConfig;
    }

    public int getSourceCount() {
        return sourceCount;
    }

    public SizeKey getSizeKey() {
        return sizeKey;
    }

    public String getFilterName() {
        return filterName;
    }

    public Double getMeanTemperature() {
        return meanTemperature;
    }

    public Double getMeanExposure() {
        return meanExposure;
    }

    public String getPrecalibrationDescription() {
        return precalibrationDescription;
    }

    public boolean isDoublePrecision() {
        return doublePrecision;
    }

    /**
     * @return comment line describing how this frame was produced.
     */
    public String getComment() {
        return "Master Bias " + combineConfig.getDescription() + " combined from " + sourceCount + " frames";
    }

    @Override
    public String toString() {
        return "master " + sizeKey + " from " + sourceCount + " frames (" + combineConfig + ")";
    }
}
