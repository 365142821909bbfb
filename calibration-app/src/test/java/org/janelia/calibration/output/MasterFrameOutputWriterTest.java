package org.janelia.calibration.output;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import nom.tam.fits.Fits;
import nom.tam.fits.Header;

import org.janelia.calibration.FitsFixtures;
import org.janelia.calibration.OutputFailureException;
import org.janelia.calibration.WriteConflictException;
import org.janelia.calibration.combine.CombineConfig;
import org.janelia.calibration.combine.MasterFrame;
import org.janelia.calibration.frame.FitsFrameReader;
import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.FramePixels;
import org.janelia.calibration.frame.FrameType;
import org.janelia.calibration.frame.SizeKey;
import org.janelia.calibration.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link MasterFrameOutputWriter} and {@link FitsFrameWriter} classes.
 */
public class MasterFrameOutputWriterTest {

    private File testDirectory;
    private MasterFrame masterFrame;

    @Before
    public void setup() throws Exception {
        testDirectory = FitsFixtures.createTestDirectory("test_output_writer");
        masterFrame = new MasterFrame(new FramePixels(3, 2, new double[] { 1, 2, 3, 4, 5, 6.5 }),
                                      CombineConfig.sigmaClip(2.5),
                                      7,
                                      new SizeKey(3, 2, 2, 2),
                                      "Lum",
                                      -10.25,
                                      0.5,
                                      "pedestal 100.0",
                                      false);
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testWriteAndReadBack() throws Exception {

        final Path outputPath = testDirectory.toPath().resolve("nested").resolve("master.fit");
        final MasterFrameOutputWriter writer = new MasterFrameOutputWriter(new FitsFrameWriter());

        writer.claim(outputPath);
        writer.write(masterFrame, outputPath);

        Assert.assertTrue("output file missing", Files.exists(outputPath));
        Assert.assertEquals("temporary files should be removed", 1, countFiles(outputPath.getParent()));

        final FitsFrameReader reader = new FitsFrameReader();
        final Frame frame = reader.readFrame(outputPath);
        Assert.assertEquals("invalid size key", masterFrame.getSizeKey(), frame.getSizeKey());
        Assert.assertEquals("invalid type", FrameType.BIAS, frame.getType());
        Assert.assertEquals("invalid filter", "Lum", frame.getFilterName());
        Assert.assertEquals("invalid temperature", -10.25, frame.getTemperature(), 0.0001);
        Assert.assertEquals("invalid exposure", 0.5, frame.getExposure(), 0.0001);
        Assert.assertEquals("float samples should be written", -32, frame.getBitsPerPixel());

        final FramePixels pixels = reader.readPixels(frame);
        Assert.assertEquals("invalid sample (2, 1)", 6.5, pixels.get(2, 1), 0.0);
        Assert.assertEquals("invalid sample (0, 0)", 1.0, pixels.get(0, 0), 0.0);

        try (final Fits fits = new Fits(outputPath.toFile())) {
            final Header header = fits.getHDU(0).getHeader();
            Assert.assertEquals("invalid source count", 7, header.getIntValue(FitsFrameWriter.SOURCE_COUNT_KEY));
            Assert.assertEquals("invalid method", "Sigma Clip", header.getStringValue(FitsFrameWriter.METHOD_KEY));
            Assert.assertEquals("invalid sigma threshold",
                                2.5, header.getDoubleValue(FitsFrameWriter.SIGMA_THRESHOLD_KEY), 0.0001);
            Assert.assertFalse("clip count should only be written for min/max clipping",
                               header.containsKey(FitsFrameWriter.CLIP_COUNT_KEY));
            Assert.assertEquals("invalid precalibration",
                                "pedestal 100.0", header.getStringValue(FitsFrameWriter.PRECALIBRATION_KEY));
        }
    }

    @Test
    public void testDoublePrecision() throws Exception {

        final MasterFrame doubleFrame = new MasterFrame(masterFrame.getPixels(),
                                                        CombineConfig.mean(),
                                                        3,
                                                        masterFrame.getSizeKey(),
                                                        null,
                                                        null,
                                                        null,
                                                        null,
                                                        true);

        final Path outputPath = testDirectory.toPath().resolve("master64.fit");
        final MasterFrameOutputWriter writer = new MasterFrameOutputWriter(new FitsFrameWriter());
        writer.claim(outputPath);
        writer.write(doubleFrame, outputPath);

        final Frame frame = new FitsFrameReader().readFrame(outputPath);
        Assert.assertEquals("double samples should be written", -64, frame.getBitsPerPixel());
        Assert.assertFalse("temperature should be omitted", frame.hasTemperature());
        Assert.assertNull("filter should be omitted", frame.getFilterName());
    }

    @Test
    public void testReplaceFileFromEarlierRun() throws Exception {

        final Path outputPath = testDirectory.toPath().resolve("master.fit");
        Files.write(outputPath, new byte[] { 1, 2, 3 });

        final MasterFrameOutputWriter writer = new MasterFrameOutputWriter(new FitsFrameWriter());
        writer.claim(outputPath);
        writer.write(masterFrame, outputPath);

        Assert.assertEquals("existing file should be replaced",
                            3, new FitsFrameReader().readFrame(outputPath).getWidth());
    }

    @Test
    public void testSecondClaimConflicts() throws Exception {

        final Path outputPath = testDirectory.toPath().resolve("master.fit");
        final MasterFrameOutputWriter writer = new MasterFrameOutputWriter(new FitsFrameWriter());
        writer.claim(outputPath);

        try {
            writer.claim(testDirectory.toPath().resolve("other").resolve("..").resolve("master.fit"));
            Assert.fail("second claim of same path should fail");
        } catch (final WriteConflictException e) {
            Assert.assertTrue("invalid message: " + e.getMessage(), e.getMessage().contains("master.fit"));
        }
    }

    @Test(expected = OutputFailureException.class)
    public void testUnclaimedWrite() throws Exception {
        final MasterFrameOutputWriter writer = new MasterFrameOutputWriter(new FitsFrameWriter());
        writer.write(masterFrame, testDirectory.toPath().resolve("master.fit"));
    }

    @Test
    public void testFailedWriteLeavesNothingBehind() throws Exception {

        final Path outputPath = testDirectory.toPath().resolve("master.fit");
        final MasterFrameOutputWriter writer = new MasterFrameOutputWriter((frame, path) -> {
            Files.write(path, new byte[] { 1, 2, 3 });
            throw new IOException("disk full");
        });
        writer.claim(outputPath);

        try {
            writer.write(masterFrame, outputPath);
            Assert.fail("write failure should cause exception");
        } catch (final OutputFailureException e) {
            Assert.assertTrue("cause should be retained", e.getCause() instanceof IOException);
        }

        Assert.assertEquals("no files should remain", 0, countFiles(testDirectory.toPath()));
    }

    private static long countFiles(final Path directory) throws IOException {
        try (final Stream<Path> stream = Files.list(directory)) {
            return stream.count();
        }
    }
}
