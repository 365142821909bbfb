package org.janelia.calibration.util;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.janelia.calibration.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 */
public class FileUtil {

    public static void saveJsonFile(final String path,
                                    final Object data)
            throws IOException {
        saveJsonFile(path, data, JsonUtils.MAPPER);
    }

    public static void saveJsonFile(final String path,
                                    final Object data,
                                    final ObjectMapper mapper)
            throws IOException {

        final Path toPath = Path.of(path).toAbsolutePath();

        final Path parentPath = toPath.getParent();
        if (parentPath != null) {
            ensureWritableDirectory(parentPath.toFile());
        }

        try (final Writer writer = Files.newBufferedWriter(toPath, StandardCharsets.UTF_8)) {
            mapper.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + toPath, t);
        }

        LOG.info("saveJsonFile: exit, wrote data to {}", toPath);
    }

    public static void ensureWritableDirectory(final File directory) {
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                // another worker may have created it concurrently
                if (! directory.exists()) {
                    throw new IllegalArgumentException("failed to create " + directory);
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory()){
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteRecursive(f) && deleteSuccessful;
                }
            }
        }

        if (file.delete()) {
            LOG.debug("deleted " + file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete " + file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    /**
     * @param  files  non-empty list of absolute file paths.
     *
     * @return deepest directory containing every file, or the first file's directory
     *         if the files share no common ancestor (e.g. different file system roots).
     */
    public static Path getCommonParent(final List<Path> files) {

        final Path firstParent = files.get(0).getParent();
        Path commonParent = firstParent;

        for (int i = 1; (commonParent != null) && (i < files.size()); i++) {
            final Path parent = files.get(i).getParent();
            while ((commonParent != null) && ((parent == null) || (! parent.startsWith(commonParent)))) {
                commonParent = commonParent.getParent();
            }
        }

        return commonParent == null ? firstParent : commonParent;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
