package com.spritefx.image;

/**
 * Contract for the indexed-color buffers that transforms read and produce.
 *
 * <p>Reads outside the image never fail: they return {@link #getBackground()}.
 * Writes outside the image are ignored.
 *
 * <p>Transforms treat their inputs as values. They read from a source image
 * and return a new image created with {@link #createBlank(int, int)}, so the
 * result is always of the same implementation as the source.
 */
public interface PixelImage {

    /**
     * @return width in pixels
     */
    int getWidth();

    /**
     * @return height in pixels
     */
    int getHeight();

    /**
     * @return the color index read back for out-of-range coordinates
     */
    int getBackground();

    /**
     * Read a pixel.
     *
     * @param x column, may lie outside the image
     * @param y row, may lie outside the image
     * @return the color index, or the background for out-of-range coordinates
     */
    int getPixel(int x, int y);

    /**
     * Write a pixel. Out-of-range coordinates are ignored.
     */
    void setPixel(int x, int y, int color);

    /**
     * Check whether a coordinate lies inside the image.
     */
    default boolean contains(int x, int y) {
        return x >= 0 && x < getWidth() && y >= 0 && y < getHeight();
    }

    /**
     * @return an independent copy sharing no pixel storage with this image
     */
    PixelImage copy();

    /**
     * Create an image of the same kind and background, filled with the background.
     *
     * @param width  width of the new image
     * @param height height of the new image
     * @return a blank image
     */
    PixelImage createBlank(int width, int height);
}
