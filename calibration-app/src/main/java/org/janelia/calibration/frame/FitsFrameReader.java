package org.janelia.calibration.frame;

import java.io.IOException;
import java.nio.file.Path;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

import org.janelia.calibration.DimensionMismatchException;
import org.janelia.calibration.IncompleteMetadataException;
import org.janelia.calibration.UnreadableFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads frames from the primary HDU of FITS files.
 *
 * Dimensions (NAXIS, NAXIS1, NAXIS2) are required.
 * Binning, temperature, exposure, type, and filter cards are optional.
 * When IMAGETYP is missing, the type is guessed from the file name.
 */
public class FitsFrameReader
        implements FrameReader {

    public static final String BITPIX_KEY = "BITPIX";
    public static final String NAXIS_KEY = "NAXIS";
    public static final String NAXIS1_KEY = "NAXIS1";
    public static final String NAXIS2_KEY = "NAXIS2";
    public static final String BZERO_KEY = "BZERO";
    public static final String BSCALE_KEY = "BSCALE";
    public static final String IMAGE_TYPE_KEY = "IMAGETYP";
    public static final String X_BINNING_KEY = "XBINNING";
    public static final String Y_BINNING_KEY = "YBINNING";
    public static final String FILTER_KEY = "FILTER";
    public static final String EXPOSURE_TIME_KEY = "EXPTIME";
    public static final String EXPOSURE_KEY = "EXPOSURE";
    public static final String TEMPERATURE_KEY = "CCD-TEMP";

    @Override
    public Frame readFrame(final Path path)
            throws UnreadableFileException, IncompleteMetadataException {

        final Header header = readHeader(path);

        final int numberOfAxes = header.getIntValue(NAXIS_KEY, 0);
        if ((numberOfAxes != 2) || (! header.containsKey(NAXIS1_KEY)) || (! header.containsKey(NAXIS2_KEY))) {
            throw new IncompleteMetadataException(path + " does not describe a two dimensional image (NAXIS is " +
                                                  numberOfAxes + ")");
        }

        final int width = header.getIntValue(NAXIS1_KEY);
        final int height = header.getIntValue(NAXIS2_KEY);
        if ((width < 1) || (height < 1)) {
            throw new IncompleteMetadataException(path + " has invalid dimensions " + width + "x" + height);
        }

        final SizeKey sizeKey = new SizeKey(width,
                                            height,
                                            getBinning(path, header, X_BINNING_KEY),
                                            getBinning(path, header, Y_BINNING_KEY));

        final Double temperature = getOptionalDouble(header, TEMPERATURE_KEY);

        Double exposure = getOptionalDouble(header, EXPOSURE_TIME_KEY);
        if (exposure == null) {
            exposure = getOptionalDouble(header, EXPOSURE_KEY);
        }

        final FrameType type;
        if (header.containsKey(IMAGE_TYPE_KEY)) {
            type = FrameType.fromHeaderValue(header.getStringValue(IMAGE_TYPE_KEY));
        } else {
            type = FrameType.fromFileName(path.getFileName().toString());
        }

        String filterName = header.getStringValue(FILTER_KEY);
        if (filterName != null) {
            filterName = filterName.trim();
            if (filterName.isEmpty()) {
                filterName = null;
            }
        }

        final Frame frame = new Frame(path,
                                      sizeKey,
                                      temperature,
                                      exposure,
                                      type,
                                      filterName,
                                      header.getIntValue(BITPIX_KEY, 0));

        LOG.debug("readFrame: read {}", frame);

        return frame;
    }

    @Override
    public FramePixels readPixels(final Frame frame)
            throws UnreadableFileException, DimensionMismatchException {

        final Path path = frame.getPath();

        final Object kernel;
        final double zero;
        final double scale;
        try (final Fits fits = new Fits(path.toFile())) {
            final BasicHDU<?> hdu = getPrimaryHdu(fits, path);
            kernel = hdu.getKernel();
            zero = hdu.getHeader().getDoubleValue(BZERO_KEY, 0.0);
            scale = hdu.getHeader().getDoubleValue(BSCALE_KEY, 1.0);
        } catch (final FitsException | IOException | RuntimeException e) {
            throw new UnreadableFileException("failed to read pixel data from " + path, e);
        }

        return toPixels(frame, kernel, zero, scale);
    }

    private Header readHeader(final Path path)
            throws UnreadableFileException {
        try (final Fits fits = new Fits(path.toFile())) {
            return getPrimaryHdu(fits, path).getHeader();
        } catch (final FitsException | IOException | RuntimeException e) {
            throw new UnreadableFileException("failed to read FITS header from " + path, e);
        }
    }

    private static BasicHDU<?> getPrimaryHdu(final Fits fits,
                                             final Path path)
            throws FitsException, IOException {
        final BasicHDU<?> hdu = fits.getHDU(0);
        if (hdu == null) {
            throw new FitsException("no header data unit found in " + path);
        }
        return hdu;
    }

    private static int getBinning(final Path path,
                                  final Header header,
                                  final String key) {
        int binning = header.getIntValue(key, 1);
        if (binning < 1) {
            LOG.warn("getBinning: ignoring invalid {} value {} in {}", key, binning, path);
            binning = 1;
        }
        return binning;
    }

    private static Double getOptionalDouble(final Header header,
                                            final String key) {
        return header.containsKey(key) ? header.getDoubleValue(key) : null;
    }

    /**
     * Converts a FITS data kernel into scaled double samples.
     * Kernels are indexed [row][column] with NAXIS2 rows of NAXIS1 samples.
     */
    static FramePixels toPixels(final Frame frame,
                                final Object kernel,
                                final double zero,
                                final double scale)
            throws UnreadableFileException, DimensionMismatchException {

        final int width = frame.getWidth();
        final int height = frame.getHeight();

        if (! (kernel instanceof Object[])) {
            throw new UnreadableFileException(frame.getPath() + " does not contain two dimensional image data");
        }

        final Object[] rows = (Object[]) kernel;
        if (rows.length != height) {
            throw new DimensionMismatchException(frame.getPath() + " contains " + rows.length +
                                                 " rows but its header specifies " + height);
        }

        final FramePixels pixels = new FramePixels(width, height);
        final double[] samples = pixels.getSamples();

        for (int y = 0; y < height; y++) {
            final Object row = rows[y];
            final int offset = y * width;
            if (row instanceof short[]) {
                final short[] values = (short[]) row;
                checkRowLength(frame, y, values.length);
                for (int x = 0; x < width; x++) {
                    samples[offset + x] = zero + (scale * values[x]);
                }
            } else if (row instanceof float[]) {
                final float[] values = (float[]) row;
                checkRowLength(frame, y, values.length);
                for (int x = 0; x < width; x++) {
                    samples[offset + x] = zero + (scale * values[x]);
                }
            } else if (row instanceof int[]) {
                final int[] values = (int[]) row;
                checkRowLength(frame, y, values.length);
                for (int x = 0; x < width; x++) {
                    samples[offset + x] = zero + (scale * values[x]);
                }
            } else if (row instanceof double[]) {
                final double[] values = (double[]) row;
                checkRowLength(frame, y, values.length);
                for (int x = 0; x < width; x++) {
                    samples[offset + x] = zero + (scale * values[x]);
                }
            } else if (row instanceof byte[]) {
                // FITS 8 bit data is unsigned
                final byte[] values = (byte[]) row;
                checkRowLength(frame, y, values.length);
                for (int x = 0; x < width; x++) {
                    samples[offset + x] = zero + (scale * (values[x] & 0xff));
                }
            } else if (row instanceof long[]) {
                final long[] values = (long[]) row;
                checkRowLength(frame, y, values.length);
                for (int x = 0; x < width; x++) {
                    samples[offset + x] = zero + (scale * values[x]);
                }
            } else {
                throw new UnreadableFileException(frame.getPath() + " contains unsupported sample type " +
                                                  (row == null ? null : row.getClass().getSimpleName()));
            }
        }

        return pixels;
    }

    private static void checkRowLength(final Frame frame,
                                       final int y,
                                       final int rowLength)
            throws DimensionMismatchException {
        if (rowLength != frame.getWidth()) {
            throw new DimensionMismatchException(frame.getPath() + " row " + y + " contains " + rowLength +
                                                 " samples but its header specifies " + frame.getWidth());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitsFrameReader.class);
}
