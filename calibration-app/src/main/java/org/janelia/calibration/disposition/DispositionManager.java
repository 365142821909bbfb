package org.janelia.calibration.disposition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.calibration.combine.CombineConfig;
import org.janelia.calibration.frame.Frame;
import org.janelia.calibration.group.FrameGroup;
import org.janelia.calibration.output.NameTemplate;
import org.janelia.calibration.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves a group's input files out of the way once its master frame is safely written.
 * Each file is moved independently: a failed move is reported and does not undo other moves.
 */
public class DispositionManager {

    private final DispositionConfig config;
    private final CombineConfig combineConfig;
    private final NameTemplate subfolderTemplate;
    private final LocalDateTime runStartTime;

    public DispositionManager(final DispositionConfig config,
                              final CombineConfig combineConfig,
                              final LocalDateTime runStartTime) {
        this.config = config;
        this.combineConfig = combineConfig;
        this.subfolderTemplate = config.getMode() == DispositionMode.MOVE_TO_SUBFOLDER ?
                                 new NameTemplate(config.getSubfolderTemplate()) : null;
        this.runStartTime = runStartTime;
    }

    /**
     * @param  group  group whose master frame has been written.
     *
     * @return outcome for each member file (empty when files are left in place).
     */
    public List<FileDisposition> dispose(final FrameGroup group) {

        if (subfolderTemplate == null) {
            return Collections.emptyList();
        }

        final List<Path> sourcePaths = group.getFrames().stream()
                .map(Frame::getPath)
                .map(Path::toAbsolutePath)
                .collect(Collectors.toList());

        final Path parentDirectory = FileUtil.getCommonParent(sourcePaths);
        final Path subfolder = parentDirectory.resolve(subfolderTemplate.apply(group, combineConfig, runStartTime));

        final List<FileDisposition> dispositions = new ArrayList<>(sourcePaths.size());

        try {
            Files.createDirectories(subfolder);
        } catch (final IOException e) {
            LOG.warn("dispose: failed to create " + subfolder, e);
            for (final Path sourcePath : sourcePaths) {
                dispositions.add(FileDisposition.failed(sourcePath,
                                                        subfolder.resolve(sourcePath.getFileName()),
                                                        "failed to create " + subfolder + ": " + e.getMessage()));
            }
            return dispositions;
        }

        int movedCount = 0;
        for (final Path sourcePath : sourcePaths) {
            final Path targetPath = subfolder.resolve(sourcePath.getFileName());
            if (Files.exists(targetPath)) {
                dispositions.add(FileDisposition.failed(sourcePath, targetPath, targetPath + " already exists"));
                continue;
            }
            try {
                Files.move(sourcePath, targetPath);
                dispositions.add(FileDisposition.moved(sourcePath, targetPath));
                movedCount++;
            } catch (final IOException e) {
                LOG.warn("dispose: failed to move " + sourcePath + " to " + targetPath, e);
                dispositions.add(FileDisposition.failed(sourcePath, targetPath, e.toString()));
            }
        }

        LOG.info("dispose: exit, moved {} of {} files to {}", movedCount, sourcePaths.size(), subfolder);

        return dispositions;
    }

    private static final Logger LOG = LoggerFactory.getLogger(DispositionManager.class);
}
