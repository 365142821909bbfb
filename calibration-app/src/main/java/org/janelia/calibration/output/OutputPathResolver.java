package org.janelia.calibration.output;

import java.nio.file.Path;
import java.time.LocalDateTime;

import org.janelia.calibration.combine.CombineConfig;
import org.janelia.calibration.group.FrameGroup;

/**
 * Resolves the file location for each group's master frame.
 */
public class OutputPathResolver {

    private final OutputConfig config;
    private final CombineConfig combineConfig;
    private final NameTemplate nameTemplate;
    private final LocalDateTime runStartTime;

    public OutputPathResolver(final OutputConfig config,
                              final CombineConfig combineConfig,
                              final LocalDateTime runStartTime) {
        this.config = config;
        this.combineConfig = combineConfig;
        this.nameTemplate = config.isSinglePath() ? null : new NameTemplate(config.getNameTemplate());
        this.runStartTime = runStartTime;
    }

    /**
     * @param  group  non-empty group being combined.
     *
     * @return absolute, normalized output path for the group's master frame.
     */
    public Path resolve(final FrameGroup group) {

        final Path path;
        if (config.isSinglePath()) {
            path = config.getOutputPath();
        } else {
            final String fileName = nameTemplate.apply(group, combineConfig, runStartTime);
            final Path directory;
            if (config.getOutputDirectory() == null) {
                directory = group.getFrames().get(0).getPath().toAbsolutePath().getParent();
            } else {
                directory = config.getOutputDirectory();
            }
            path = directory.resolve(fileName);
        }

        return path.toAbsolutePath().normalize();
    }
}
