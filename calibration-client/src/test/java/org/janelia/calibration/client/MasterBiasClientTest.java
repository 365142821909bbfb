package org.janelia.calibration.client;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.util.BufferedFile;

import org.janelia.calibration.GroupStatus;
import org.janelia.calibration.RunConfig;
import org.janelia.calibration.RunOutcome;
import org.janelia.calibration.RunStatus;
import org.janelia.calibration.client.parameter.CommandLineParameters;
import org.janelia.calibration.combine.CombineMethod;
import org.janelia.calibration.disposition.DispositionMode;
import org.janelia.calibration.precalibration.PrecalibrationMode;
import org.janelia.calibration.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link MasterBiasClient} class.
 */
public class MasterBiasClientTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMddHHmmssSSS");
        testDirectory = new File("target", "test_master_bias_client_" + sdf.format(new Date())).getCanonicalFile();
        if (! testDirectory.mkdirs()) {
            throw new IllegalStateException("failed to create " + testDirectory);
        }
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testParameterParsing() {
        CommandLineParameters.parseHelp(new MasterBiasClient.Parameters());
    }

    @Test
    public void testDefaultRunConfig() {

        final RunConfig runConfig = parse("a.fit", "b.fit").toRunConfig();

        Assert.assertEquals("invalid method", CombineMethod.MEAN, runConfig.getCombineConfig().getMethod());
        Assert.assertFalse("grouping should be off", runConfig.getGroupingConfig().isGrouping());
        Assert.assertEquals("invalid precalibration mode",
                            PrecalibrationMode.NONE, runConfig.getPrecalibrationConfig().getMode());
        Assert.assertFalse("output should not be a single path", runConfig.getOutputConfig().isSinglePath());
        Assert.assertEquals("invalid disposition mode",
                            DispositionMode.LEAVE_IN_PLACE, runConfig.getDispositionConfig().getMode());
    }

    @Test
    public void testRunConfigOptions() {

        final MasterBiasClient.Parameters parameters = parse("--method", "sigma",
                                                             "--sigmaThreshold", "2.5",
                                                             "--groupByTemperature",
                                                             "--temperatureBandwidth", "0.5",
                                                             "--minimumGroupSize", "3",
                                                             "--pedestal", "100",
                                                             "--outputDirectory", testDirectory.getPath(),
                                                             "--moveInputsTo", "used-%d",
                                                             "--numberOfThreads", "3",
                                                             "a.fit", "b.fit", "c.fit");
        final RunConfig runConfig = parameters.toRunConfig();

        Assert.assertEquals("invalid number of inputs", 3, parameters.getInputPaths().size());
        Assert.assertEquals("invalid method", CombineMethod.SIGMA_CLIP, runConfig.getCombineConfig().getMethod());
        Assert.assertEquals("invalid sigma", 2.5, runConfig.getCombineConfig().getSigmaThreshold(), 0.0);
        Assert.assertTrue("temperature grouping should be on",
                          runConfig.getGroupingConfig().isGroupByTemperature());
        Assert.assertEquals("invalid bandwidth",
                            0.5, runConfig.getGroupingConfig().getTemperatureBandwidth(), 0.0);
        Assert.assertEquals("invalid minimum group size", 3, runConfig.getGroupingConfig().getMinimumGroupSize());
        Assert.assertEquals("invalid precalibration mode",
                            PrecalibrationMode.PEDESTAL, runConfig.getPrecalibrationConfig().getMode());
        Assert.assertEquals("invalid disposition mode",
                            DispositionMode.MOVE_TO_SUBFOLDER, runConfig.getDispositionConfig().getMode());
        Assert.assertEquals("invalid number of threads", 3, runConfig.getNumberOfThreads());
    }

    @Test
    public void testMethodAliases() {
        Assert.assertEquals("invalid method for minmax",
                            CombineMethod.MIN_MAX_CLIP, parse("--method", "minmax").combine.getMethod());
        Assert.assertEquals("invalid method for MEDIAN",
                            CombineMethod.MEDIAN, parse("--method", "MEDIAN").combine.getMethod());
        Assert.assertEquals("invalid method for sigma_clip",
                            CombineMethod.SIGMA_CLIP, parse("--method", "sigma_clip").combine.getMethod());
    }

    @Test
    public void testInvalidOptions() {
        assertInvalid("--gui");
        assertInvalid("--method", "average");
        assertInvalid("--clipCount", "-1");
        assertInvalid("--sigmaThreshold", "0");
        assertInvalid("--temperatureBandwidth", "0", "--groupByTemperature");
        assertInvalid("--minimumGroupSize", "0");
        assertInvalid("--pedestal", "10", "--biasFrame", "bias.fit");
        assertInvalid("--outputPath", "master.fit", "--groupBySize");
        assertInvalid("--outputPath", "master.fit", "--outputDirectory", "masters");
        assertInvalid("--outputNameTemplate", "bias-%q.fit");
        assertInvalid("--numberOfThreads", "0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOption() {
        parse("--noSuchOption", "a.fit");
    }

    @Test
    public void testMisspelledOptionIsNotTreatedAsInput() {
        try {
            parse("--pedestel", "100", "a.fit");
            Assert.fail("misspelled option should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name the option: " + e.getMessage(),
                              e.getMessage().contains("--pedestel"));
        }
    }

    @Test
    public void testRun() throws Exception {

        final Path inputDirectory = testDirectory.toPath().resolve("night1");
        Files.createDirectories(inputDirectory);
        final Path first = writeBiasFrame(inputDirectory.resolve("bias-1.fit"), 100);
        final Path second = writeBiasFrame(inputDirectory.resolve("bias-2.fit"), 300);
        final Path outputPath = testDirectory.toPath().resolve("master.fit");
        final Path outcomeFile = testDirectory.toPath().resolve("outcome.json");

        final MasterBiasClient client = new MasterBiasClient(parse("--outputPath", outputPath.toString(),
                                                                   "--outcomeFile", outcomeFile.toString(),
                                                                   first.toString(),
                                                                   second.toString()));
        final RunOutcome outcome = client.run();

        Assert.assertTrue("run should be successful: " + outcome, outcome.isSuccessful());
        Assert.assertTrue("master missing", Files.exists(outputPath));
        Assert.assertTrue("outcome file missing", Files.exists(outcomeFile));

        final RunOutcome savedOutcome = RunOutcome.fromJson(Files.readString(outcomeFile));
        Assert.assertEquals("invalid saved status", RunStatus.COMPLETED, savedOutcome.getStatus());
        Assert.assertEquals("invalid saved written count", 1, savedOutcome.getGroupCount(GroupStatus.WRITTEN));
        Assert.assertEquals("invalid saved output path",
                            outputPath.toString(), savedOutcome.getGroupOutcomes().get(0).getOutputPath());
    }

    @Test
    public void testRunWithoutUsableFiles() throws Exception {

        final MasterBiasClient client =
                new MasterBiasClient(parse(testDirectory.toPath().resolve("missing.fit").toString()));
        final RunOutcome outcome = client.run();

        Assert.assertEquals("invalid status", RunStatus.EMPTY_INPUT, outcome.getStatus());
        Assert.assertFalse("run should not be successful", outcome.isSuccessful());
    }

    private static MasterBiasClient.Parameters parse(final String... args) {
        final MasterBiasClient.Parameters parameters = new MasterBiasClient.Parameters();
        parameters.parse(args, MasterBiasClient.class, false);
        return parameters;
    }

    private static void assertInvalid(final String... args) {
        try {
            new MasterBiasClient(parse(args));
            Assert.fail("arguments " + Arrays.asList(args) + " should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertNotNull("exception should have a message", e.getMessage());
        }
    }

    private static Path writeBiasFrame(final Path path,
                                       final int value)
            throws Exception {
        final short[][] rows = new short[4][6];
        for (final short[] row : rows) {
            Arrays.fill(row, (short) value);
        }
        try (final Fits fits = new Fits()) {
            final BasicHDU<?> hdu = Fits.makeHDU(rows);
            hdu.getHeader().addValue("IMAGETYP", "Bias Frame", null);
            fits.addHDU(hdu);
            try (final BufferedFile file = new BufferedFile(path.toFile(), "rw")) {
                fits.write(file);
            }
        }
        return path;
    }
}
