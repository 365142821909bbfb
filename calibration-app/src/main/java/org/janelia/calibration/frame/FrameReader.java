package org.janelia.calibration.frame;

import java.nio.file.Path;

import org.janelia.calibration.DimensionMismatchException;
import org.janelia.calibration.IncompleteMetadataException;
import org.janelia.calibration.UnreadableFileException;

/**
 * Reads frame attributes and pixel data from image files.
 */
public interface FrameReader {

    /**
     * Reads header attributes without loading pixel data.
     *
     * @param  path  file to read.
     *
     * @return the frame's attributes.
     *
     * @throws UnreadableFileException
     *   if the file cannot be parsed.
     *
     * @throws IncompleteMetadataException
     *   if the file's dimensions are missing.
     */
    Frame readFrame(final Path path)
            throws UnreadableFileException, IncompleteMetadataException;

    /**
     * Loads the pixel data for a previously read frame.
     *
     * @param  frame  frame to load.
     *
     * @return the frame's samples with any stored scaling applied.
     *
     * @throws UnreadableFileException
     *   if the file's data cannot be parsed.
     *
     * @throws DimensionMismatchException
     *   if the data does not match the frame's header dimensions.
     */
    FramePixels readPixels(final Frame frame)
            throws UnreadableFileException, DimensionMismatchException;

}
