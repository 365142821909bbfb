package org.janelia.calibration.output;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Immutable output location settings.
 * Exactly one of three forms applies: a single output path, a directory with a name template,
 * or a templated name placed beside each group's first input file.
 */
public class OutputConfig
        implements Serializable {

    public static final String DEFAULT_NAME_TEMPLATE = "BIAS-%m-%d-%t-%es-%cC-%x-%b.fit";

    private final String outputPath;
    private final String outputDirectory;
    private final String nameTemplate;

    private OutputConfig(final String outputPath,
                         final String outputDirectory,
                         final String nameTemplate) {
        this.outputPath = outputPath;
        this.outputDirectory = outputDirectory;
        this.nameTemplate = nameTemplate;
    }

    public static OutputConfig singlePath(final Path outputPath)
            throws IllegalArgumentException {
        if (outputPath == null) {
            throw new IllegalArgumentException("output path must be specified");
        }
        return new OutputConfig(outputPath.toString(), null, null);
    }

    /**
     * @throws IllegalArgumentException
     *   if the directory is missing or the template is invalid.
     */
    public static OutputConfig directory(final Path outputDirectory,
                                         final String nameTemplate)
            throws IllegalArgumentException {
        if (outputDirectory == null) {
            throw new IllegalArgumentException("output directory must be specified");
        }
        final String template = nameTemplate == null ? DEFAULT_NAME_TEMPLATE : nameTemplate;
        new NameTemplate(template);
        return new OutputConfig(null, outputDirectory.toString(), template);
    }

    public static OutputConfig besideInputs(final String nameTemplate)
            throws IllegalArgumentException {
        final String template = nameTemplate == null ? DEFAULT_NAME_TEMPLATE : nameTemplate;
        new NameTemplate(template);
        return new OutputConfig(null, null, template);
    }

    public static OutputConfig besideInputs() {
        return besideInputs(DEFAULT_NAME_TEMPLATE);
    }

    public boolean isSinglePath() {
        return outputPath != null;
    }

    public Path getOutputPath() {
        return outputPath == null ? null : Path.of(outputPath);
    }

    public Path getOutputDirectory() {
        return outputDirectory == null ? null : Path.of(outputDirectory);
    }

    public String getNameTemplate() {
        return nameTemplate;
    }

    @Override
    public String toString() {
        final String description;
        if (outputPath != null) {
            description = "{outputPath: " + outputPath + '}';
        } else if (outputDirectory != null) {
            description = "{outputDirectory: " + outputDirectory + ", nameTemplate: " + nameTemplate + '}';
        } else {
            description = "{besideInputs, nameTemplate: " + nameTemplate + '}';
        }
        return description;
    }
}
