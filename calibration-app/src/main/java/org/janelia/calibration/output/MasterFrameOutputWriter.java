package org.janelia.calibration.output;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.janelia.calibration.OutputFailureException;
import org.janelia.calibration.WriteConflictException;
import org.janelia.calibration.combine.MasterFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists master frames for one run.
 *
 * Output paths must be claimed before they are written and each path can only be claimed once per run.
 * Frames are written to a temporary file in the target directory and then renamed into place
 * so that readers never see a partially written file.
 * Instances are thread safe.
 */
public class MasterFrameOutputWriter {

    private final FrameWriter frameWriter;
    private final Set<Path> claimedPaths;

    public MasterFrameOutputWriter(final FrameWriter frameWriter) {
        this.frameWriter = frameWriter;
        this.claimedPaths = ConcurrentHashMap.newKeySet();
    }

    /**
     * Reserves an output path for the current run.
     *
     * @throws WriteConflictException
     *   if the path was already claimed by an earlier group in this run.
     */
    public void claim(final Path outputPath)
            throws WriteConflictException {
        final Path normalizedPath = outputPath.toAbsolutePath().normalize();
        if (! claimedPaths.add(normalizedPath)) {
            throw new WriteConflictException(normalizedPath + " was already produced by an earlier group in this run");
        }
    }

    /**
     * Writes a master frame to a previously claimed path, creating missing directories.
     * Files left by earlier runs are replaced.
     *
     * @throws OutputFailureException
     *   if the path was not claimed or if any file system operation fails.
     */
    public void write(final MasterFrame masterFrame,
                      final Path outputPath)
            throws OutputFailureException {

        final Path path = outputPath.toAbsolutePath().normalize();
        if (! claimedPaths.contains(path)) {
            throw new OutputFailureException("output path " + path + " was not claimed before writing");
        }

        final Path directory = path.getParent();
        final Path tempPath;
        try {
            Files.createDirectories(directory);
            tempPath = Files.createTempFile(directory, "." + path.getFileName() + ".", ".tmp");
        } catch (final IOException e) {
            throw new OutputFailureException("failed to prepare " + directory + " for output", e);
        }

        try {
            frameWriter.write(masterFrame, tempPath);
            if (Files.exists(path)) {
                LOG.warn("write: replacing existing file {}", path);
            }
            moveIntoPlace(tempPath, path);
        } catch (final IOException e) {
            deleteTemporaryFile(tempPath);
            throw new OutputFailureException("failed to write " + path, e);
        }

        LOG.info("write: exit, saved {} to {}", masterFrame, path);
    }

    private static void moveIntoPlace(final Path tempPath,
                                      final Path path)
            throws IOException {
        try {
            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            LOG.warn("moveIntoPlace: atomic move not supported for {}, using plain move", path);
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemporaryFile(final Path tempPath) {
        try {
            Files.deleteIfExists(tempPath);
        } catch (final IOException e) {
            LOG.warn("deleteTemporaryFile: failed to remove " + tempPath, e);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(MasterFrameOutputWriter.class);
}
