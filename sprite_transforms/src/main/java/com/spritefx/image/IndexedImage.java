package com.spritefx.image;

import java.util.Arrays;

/**
 * Default {@link PixelImage}: a row-major array of palette indices.
 *
 * <p>Images can be written as pixel-art literals, one row per line and one
 * character per pixel: {@code 0-9}/{@code a-f} for indices 0-15 and {@code .}
 * for transparent. Whitespace inside a row is ignored, so
 * <pre>
 * . 1 1
 * 1 2 .
 * </pre>
 * is a 3x2 image.
 */
public final class IndexedImage implements PixelImage {

    private static final int LITERAL_MAX_INDEX = 15;

    private final int width;
    private final int height;
    private final int background;
    private final int[] pixels;

    public IndexedImage(int width, int height) {
        this(width, height, Palette.TRANSPARENT);
    }

    public IndexedImage(int width, int height, int background) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image size must not be negative: " + width + "x" + height);
        }
        if (!Palette.isValidIndex(background)) {
            throw new IllegalArgumentException("Background index out of range: " + background);
        }
        this.width = width;
        this.height = height;
        this.background = background;
        this.pixels = new int[width * height];
        if (background != 0) {
            Arrays.fill(pixels, background);
        }
    }

    private IndexedImage(IndexedImage other) {
        this.width = other.width;
        this.height = other.height;
        this.background = other.background;
        this.pixels = other.pixels.clone();
    }

    /**
     * Parse a pixel-art literal with a transparent background.
     *
     * @throws IllegalArgumentException if a row holds an unknown character
     *                                  or rows differ in length
     */
    public static IndexedImage parse(String literal) {
        String[] lines = literal.strip().split("\\R");
        int[][] rows = new int[lines.length][];
        int rowCount = 0;

        for (String line : lines) {
            String row = line.replaceAll("\\s+", "");
            if (row.isEmpty()) continue;

            int[] values = new int[row.length()];
            for (int i = 0; i < row.length(); i++) {
                char ch = row.charAt(i);
                int value = ch == '.' ? Palette.TRANSPARENT : Character.digit(ch, 16);
                if (value < 0) {
                    throw new IllegalArgumentException("Unknown pixel character '" + ch + "' in row " + rowCount);
                }
                values[i] = value;
            }
            if (rowCount > 0 && values.length != rows[0].length) {
                throw new IllegalArgumentException("Row " + rowCount + " has " + values.length
                    + " pixels, expected " + rows[0].length);
            }
            rows[rowCount++] = values;
        }

        int w = rowCount == 0 ? 0 : rows[0].length;
        IndexedImage image = new IndexedImage(w, rowCount);
        for (int y = 0; y < rowCount; y++) {
            System.arraycopy(rows[y], 0, image.pixels, y * w, w);
        }
        return image;
    }

    /**
     * Write this image as a literal readable by {@link #parse(String)}.
     * Pixels are separated by single spaces.
     *
     * @throws IllegalStateException if a pixel holds an index above 15
     */
    public String toLiteral() {
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < height; y++) {
            if (y > 0) sb.append('\n');
            for (int x = 0; x < width; x++) {
                if (x > 0) sb.append(' ');
                int value = pixels[y * width + x];
                if (value > LITERAL_MAX_INDEX) {
                    throw new IllegalStateException("Index " + value + " at (" + x + ", " + y
                        + ") has no literal form");
                }
                sb.append(value == Palette.TRANSPARENT ? '.' : Character.forDigit(value, 16));
            }
        }
        return sb.toString();
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getBackground() {
        return background;
    }

    @Override
    public int getPixel(int x, int y) {
        if (!contains(x, y)) return background;
        return pixels[y * width + x];
    }

    @Override
    public void setPixel(int x, int y, int color) {
        if (!contains(x, y)) return;
        pixels[y * width + x] = color;
    }

    @Override
    public IndexedImage copy() {
        return new IndexedImage(this);
    }

    @Override
    public IndexedImage createBlank(int width, int height) {
        return new IndexedImage(width, height, background);
    }

    /**
     * Check whether every pixel holds the same index.
     * An empty image counts as uniform.
     */
    public boolean isUniform() {
        for (int i = 1; i < pixels.length; i++) {
            if (pixels[i] != pixels[0]) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexedImage other)) return false;
        return width == other.width
            && height == other.height
            && background == other.background
            && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        result = 31 * result + background;
        return 31 * result + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "IndexedImage{" + width + "x" + height + ", background=" + background + "}";
    }
}
