package org.janelia.calibration;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.calibration.combine.FrameCombiner;
import org.janelia.calibration.disposition.DispositionManager;
import org.janelia.calibration.frame.FitsFrameReader;
import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.frame.FrameReader;
import org.janelia.calibration.group.FrameGroup;
import org.janelia.calibration.group.FrameGrouper;
import org.janelia.calibration.group.FrameSelector;
import org.janelia.calibration.group.GroupingResult;
import org.janelia.calibration.output.FitsFrameWriter;
import org.janelia.calibration.output.FrameWriter;
import org.janelia.calibration.output.MasterFrameOutputWriter;
import org.janelia.calibration.output.OutputPathResolver;
import org.janelia.calibration.precalibration.Precalibrator;
import org.janelia.calibration.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines candidate bias frames into one master frame per compatible group.
 *
 * A run reads metadata for every input file, excludes unsuitable frames, partitions the rest into groups,
 * and then processes the groups in parallel.  Problems with individual files or groups are recorded in the
 * returned {@link RunOutcome}; the run as a whole only fails when nothing can be combined.
 */
public class MasterFrameMaker {

    private final FrameReader frameReader;
    private final FrameWriter frameWriter;

    public MasterFrameMaker() {
        this(new FitsFrameReader(), new FitsFrameWriter());
    }

    public MasterFrameMaker(final FrameReader frameReader,
                            final FrameWriter frameWriter) {
        this.frameReader = frameReader;
        this.frameWriter = frameWriter;
    }

    public RunOutcome run(final List<Path> inputFiles,
                          final RunConfig config)
            throws InterruptedException {
        return run(inputFiles, config, new CancellationFlag());
    }

    /**
     * @param  inputFiles        candidate files in discovery order.
     * @param  config            run settings.
     * @param  cancellationFlag  checked before each group starts.
     *
     * @return outcome of the run.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting for group workers.
     *
     * @throws IllegalStateException
     *   if a group worker fails unexpectedly.
     */
    public RunOutcome run(final List<Path> inputFiles,
                          final RunConfig config,
                          final CancellationFlag cancellationFlag)
            throws InterruptedException, IllegalStateException {

        final ProcessTimer timer = new ProcessTimer();
        final LocalDateTime runStartTime = LocalDateTime.now();
        final RunOutcome outcome = new RunOutcome(runStartTime.toString());

        LOG.info("run: entry, {} input files, config is {}", inputFiles.size(), config);

        final List<Frame> frames = readFrames(inputFiles, outcome);

        final FrameSelector.Selection selection = new FrameSelector(config.getGroupingConfig()).select(frames);
        final List<Frame> excludedFrames = selection.getExcludedFrames();
        for (int i = 0; i < excludedFrames.size(); i++) {
            outcome.addExclusion(excludedFrames.get(i).getPath(), selection.getExclusionReason(i));
        }

        if (selection.getSelectedFrames().isEmpty()) {
            outcome.setStatus(RunStatus.EMPTY_INPUT);
            LOG.warn("run: exit, no usable frames found in {} input files", inputFiles.size());
            return outcome;
        }

        final GroupingResult groupingResult =
                new FrameGrouper(config.getGroupingConfig()).group(selection.getSelectedFrames());
        groupingResult.getDroppedGroups().forEach(group -> outcome.addDroppedGroup(new DroppedGroup(group)));

        final List<FrameGroup> groups = groupingResult.getGroups();
        if (groups.isEmpty()) {
            outcome.setStatus(RunStatus.NO_GROUPS_SURVIVED);
            LOG.warn("run: exit, all {} groups had fewer than {} frames",
                     groupingResult.getDroppedGroups().size(), config.getGroupingConfig().getMinimumGroupSize());
            return outcome;
        }

        final List<Callable<GroupOutcome>> workers = buildWorkers(groups, config, runStartTime, cancellationFlag);

        final int numberOfThreads = Math.min(config.getNumberOfThreads(), workers.size());
        final ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        final List<Throwable> workerExceptions = new ArrayList<>();

        try {
            for (final Future<GroupOutcome> future : executorService.invokeAll(workers)) {
                try {
                    outcome.addGroupOutcome(future.get());
                } catch (final ExecutionException e) {
                    LOG.error("run: group worker failed", e.getCause());
                    workerExceptions.add(e.getCause());
                }
            }
        } finally {
            executorService.shutdown();
        }

        if (! workerExceptions.isEmpty()) {
            throw new IllegalStateException(workerExceptions.size() + " out of " + workers.size() +
                                            " group workers failed unexpectedly", workerExceptions.get(0));
        }

        if (outcome.getGroupCount(GroupStatus.CANCELLED) > 0) {
            outcome.setStatus(RunStatus.CANCELLED);
        }

        LOG.info("run: exit, {} after {}", outcome.getSummary(), timer);

        return outcome;
    }

    private List<Frame> readFrames(final List<Path> inputFiles,
                                   final RunOutcome outcome) {
        final List<Frame> frames = new ArrayList<>(inputFiles.size());
        for (final Path path : inputFiles) {
            try {
                frames.add(frameReader.readFrame(path));
            } catch (final UnreadableFileException | IncompleteMetadataException e) {
                LOG.warn("readFrames: skipping {}, {}", path, e.getMessage());
                outcome.addReadFailure(path, e);
            }
        }
        return frames;
    }

    /**
     * Resolves and claims output paths in group order so that conflicts are always
     * attributed to the later group, then wraps each group in a worker.
     */
    private List<Callable<GroupOutcome>> buildWorkers(final List<FrameGroup> groups,
                                                      final RunConfig config,
                                                      final LocalDateTime runStartTime,
                                                      final CancellationFlag cancellationFlag) {

        Precalibrator precalibrator = null;
        MasterFrameException precalibrationFailure = null;
        try {
            precalibrator = Precalibrator.load(config.getPrecalibrationConfig(), frameReader);
        } catch (final MasterFrameException e) {
            LOG.error("buildWorkers: failed to load precalibration data, every group will fail", e);
            precalibrationFailure = e;
        }

        final OutputPathResolver pathResolver = new OutputPathResolver(config.getOutputConfig(),
                                                                       config.getCombineConfig(),
                                                                       runStartTime);
        final MasterFrameOutputWriter outputWriter = new MasterFrameOutputWriter(frameWriter);
        final GroupProcessor processor =
                new GroupProcessor(frameReader,
                                   precalibrator,
                                   new FrameCombiner(config.getCombineConfig()),
                                   outputWriter,
                                   new DispositionManager(config.getDispositionConfig(),
                                                          config.getCombineConfig(),
                                                          runStartTime),
                                   cancellationFlag);

        final List<Callable<GroupOutcome>> workers = new ArrayList<>(groups.size());
        for (final FrameGroup group : groups) {
            final Path outputPath = pathResolver.resolve(group);
            if (precalibrationFailure != null) {
                final MasterFrameException failure = precalibrationFailure;
                workers.add(() -> GroupOutcome.failed(group, outputPath, failure, null));
            } else {
                try {
                    outputWriter.claim(outputPath);
                    workers.add(() -> processor.process(group, outputPath));
                } catch (final WriteConflictException e) {
                    LOG.error("buildWorkers: cannot write {}, {}", group, e.getMessage());
                    workers.add(() -> GroupOutcome.failed(group, outputPath, e, null));
                }
            }
        }

        return workers;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MasterFrameMaker.class);
}
