package org.janelia.calibration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.calibration.combine.FrameCombiner;
import org.janelia.calibration.combine.MasterFrame;
import org.janelia.calibration.disposition.DispositionManager;
import org.janelia.calibration.disposition.FileDisposition;
import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.FramePixels;
import org.janelia.calibration.frame.FrameReader;
import org.janelia.calibration.group.FrameGroup;
import org.janelia.calibration.output.MasterFrameOutputWriter;
import org.janelia.calibration.precalibration.Precalibrator;
import org.janelia.calibration.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Takes one group from pixel loading through disposition.
 * Collaborators are shared by all workers in a run and must be thread safe.
 */
class GroupProcessor {

    private final FrameReader frameReader;
    private final Precalibrator precalibrator;
    private final FrameCombiner combiner;
    private final MasterFrameOutputWriter outputWriter;
    private final DispositionManager dispositionManager;
    private final CancellationFlag cancellationFlag;

    GroupProcessor(final FrameReader frameReader,
                   final Precalibrator precalibrator,
                   final FrameCombiner combiner,
                   final MasterFrameOutputWriter outputWriter,
                   final DispositionManager dispositionManager,
                   final CancellationFlag cancellationFlag) {
        this.frameReader = frameReader;
        this.precalibrator = precalibrator;
        this.combiner = combiner;
        this.outputWriter = outputWriter;
        this.dispositionManager = dispositionManager;
        this.cancellationFlag = cancellationFlag;
    }

    /**
     * @param  group       group to combine.
     * @param  outputPath  path claimed for the group's master frame.
     *
     * @return outcome for the group.
     */
    GroupOutcome process(final FrameGroup group,
                         final Path outputPath) {

        if (cancellationFlag.isCancelled()) {
            LOG.info("process: run cancelled, skipping {}", group);
            return GroupOutcome.cancelled(group);
        }

        final ProcessTimer timer = new ProcessTimer();

        LOG.info("process: entry, combining {}", group);

        try {

            final List<FramePixels> stack = new ArrayList<>(group.size());
            for (final Frame frame : group.getFrames()) {
                stack.add(precalibrator.apply(frameReader.readPixels(frame)));
            }

            final MasterFrame masterFrame = new MasterFrame(combiner.combine(stack),
                                                            combiner.getConfig(),
                                                            group.size(),
                                                            group.getSizeKey(),
                                                            group.getMostCommonFilterName(),
                                                            group.getMeanTemperature(),
                                                            group.getMeanExposure(),
                                                            precalibrator.getConfig().getDescription(),
                                                            needsDoublePrecision(group));

            outputWriter.write(masterFrame, outputPath);

        } catch (final MasterFrameException e) {
            LOG.error("process: failed to produce master frame for " + group, e);
            return GroupOutcome.failed(group, outputPath, e, timer.getElapsedMilliseconds());
        }

        final List<FileDisposition> dispositions = dispositionManager.dispose(group);

        LOG.info("process: exit, wrote {} in {}", outputPath, timer);

        return GroupOutcome.written(group, outputPath, dispositions, timer.getElapsedMilliseconds());
    }

    /**
     * @return true if any source stores samples with more precision than a 32 bit float can hold.
     */
    static boolean needsDoublePrecision(final FrameGroup group) {
        boolean needsDouble = false;
        for (final Frame frame : group.getFrames()) {
            final int bitsPerPixel = frame.getBitsPerPixel();
            if ((bitsPerPixel == 32) || (bitsPerPixel == 64) || (bitsPerPixel == -64)) {
                needsDouble = true;
                break;
            }
        }
        return needsDouble;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GroupProcessor.class);
}
