package org.janelia.calibration.output;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.calibration.combine.MasterFrame;

/**
 * Encodes master frames into a persistent image format.
 */
public interface FrameWriter {

    /**
     * Writes the frame's pixels and metadata to a file that already exists and is empty.
     *
     * @throws IOException
     *   if the frame cannot be encoded or written.
     */
    void write(MasterFrame masterFrame,
               Path path)
            throws IOException;
}
