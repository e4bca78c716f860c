package org.janelia.tiling.image;

/**
 * Thrown when pixel data does not have the width, height or channel depth it is combined with.
 */
public class ShapeMismatchException
        extends IllegalArgumentException {

    public ShapeMismatchException(final String message) {
        super(message);
    }

}
