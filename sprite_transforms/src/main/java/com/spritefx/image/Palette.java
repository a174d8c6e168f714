package com.spritefx.image;

/**
 * Named color indices shared by every image in the library.
 *
 * Images are palette-indexed: a pixel holds an index, never an RGB value,
 * so transforms only ever copy indices around.
 */
public final class Palette {

    private Palette() {
        // Utility class
    }

    /** Index read back for any coordinate outside an image. */
    public static final int TRANSPARENT = 0;

    /** Highest index a pixel may hold. */
    public static final int MAX_INDEX = 255;

    /**
     * Check whether an index is usable as a pixel color.
     */
    public static boolean isValidIndex(int color) {
        return color >= 0 && color <= MAX_INDEX;
    }
}
