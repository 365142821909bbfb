package org.janelia.calibration.output;

import java.io.IOException;
import java.nio.file.Path;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;

import org.janelia.calibration.combine.CombineConfig;
import org.janelia.calibration.combine.MasterFrame;
import org.janelia.calibration.frame.FitsFrameReader;
import org.janelia.calibration.frame.FramePixels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes master frames as single HDU FITS files with 32 or 64 bit floating point samples.
 */
public class FitsFrameWriter
        implements FrameWriter {

    public static final String MASTER_IMAGE_TYPE = "Master Bias";
    public static final String SOURCE_COUNT_KEY = "NCOMBINE";
    public static final String METHOD_KEY = "COMBMETH";
    public static final String CLIP_COUNT_KEY = "COMBCLIP";
    public static final String SIGMA_THRESHOLD_KEY = "COMBSIG";
    public static final String PRECALIBRATION_KEY = "PRECAL";

    @Override
    public void write(final MasterFrame masterFrame,
                      final Path path)
            throws IOException {

        final FramePixels pixels = masterFrame.getPixels();
        final Object kernel = masterFrame.isDoublePrecision() ? toDoubleRows(pixels) : toFloatRows(pixels);

        try (final Fits fits = new Fits()) {

            final BasicHDU<?> hdu = Fits.makeHDU(kernel);
            addMetadata(masterFrame, hdu.getHeader());
            fits.addHDU(hdu);

            try (final BufferedFile file = new BufferedFile(path.toFile(), "rw")) {
                fits.write(file);
            }

        } catch (final FitsException e) {
            throw new IOException("failed to encode " + masterFrame + " for " + path, e);
        }

        LOG.debug("write: wrote {} to {}", masterFrame, path);
    }

    private static void addMetadata(final MasterFrame masterFrame,
                                    final Header header)
            throws FitsException {

        final CombineConfig combineConfig = masterFrame.getCombineConfig();

        header.addValue(FitsFrameReader.IMAGE_TYPE_KEY, MASTER_IMAGE_TYPE, "type of image");
        header.addValue(SOURCE_COUNT_KEY, masterFrame.getSourceCount(), "number of combined frames");
        header.addValue(METHOD_KEY, combineConfig.getMethod().getDisplayName(), "combination method");

        switch (combineConfig.getMethod()) {
            case MIN_MAX_CLIP:
                header.addValue(CLIP_COUNT_KEY, combineConfig.getClipCount(),
                                "samples dropped from each end");
                break;
            case SIGMA_CLIP:
                header.addValue(SIGMA_THRESHOLD_KEY, combineConfig.getSigmaThreshold(),
                                "rejection threshold in standard deviations");
                break;
            default:
                break;
        }

        if (masterFrame.getPrecalibrationDescription() != null) {
            header.addValue(PRECALIBRATION_KEY, masterFrame.getPrecalibrationDescription(),
                            "precalibration applied to sources");
        }
        if (masterFrame.getFilterName() != null) {
            header.addValue(FitsFrameReader.FILTER_KEY, masterFrame.getFilterName(), "filter name");
        }

        header.addValue(FitsFrameReader.X_BINNING_KEY, masterFrame.getSizeKey().getXBinning(), "x binning factor");
        header.addValue(FitsFrameReader.Y_BINNING_KEY, masterFrame.getSizeKey().getYBinning(), "y binning factor");

        if (masterFrame.getMeanExposure() != null) {
            header.addValue(FitsFrameReader.EXPOSURE_TIME_KEY, masterFrame.getMeanExposure(),
                            "mean source exposure (seconds)");
        }
        if (masterFrame.getMeanTemperature() != null) {
            header.addValue(FitsFrameReader.TEMPERATURE_KEY, masterFrame.getMeanTemperature(),
                            "mean source temperature (C)");
        }

        header.insertComment(masterFrame.getComment());
    }

    private static float[][] toFloatRows(final FramePixels pixels) {
        final float[][] rows = new float[pixels.getHeight()][pixels.getWidth()];
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < rows[y].length; x++) {
                rows[y][x] = (float) pixels.get(x, y);
            }
        }
        return rows;
    }

    private static double[][] toDoubleRows(final FramePixels pixels) {
        final double[][] rows = new double[pixels.getHeight()][pixels.getWidth()];
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < rows[y].length; x++) {
                rows[y][x] = pixels.get(x, y);
            }
        }
        return rows;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitsFrameWriter.class);
}
