package com.spritefx.scale;

import com.spritefx.entities.TransformStats;
import com.spritefx.image.PixelImage;

import java.util.Objects;

/**
 * Scale2x and Scale3x, the EPX (Eric's Pixel Expansion) family of pixel-art
 * up-scalers.
 *
 * <p>Each source pixel expands to an NxN block. Every sub-pixel defaults to
 * the source pixel and is overridden by a neighbor when the neighbor pattern
 * shows a diagonal edge crossing that corner. Output pixels are always copies
 * of input indices; nothing is blended.
 *
 * <p>The scaler keeps no state between calls and never modifies its input.
 */
public class PixelScaler {

    private final EdgePolicy edgePolicy;
    private final TransformStats stats;

    public PixelScaler() {
        this(EdgePolicy.BACKGROUND, null);
    }

    public PixelScaler(EdgePolicy edgePolicy) {
        this(edgePolicy, null);
    }

    /**
     * @param edgePolicy how reads beyond the image edge resolve
     * @param stats      counters to record into, or null
     */
    public PixelScaler(EdgePolicy edgePolicy, TransformStats stats) {
        this.edgePolicy = Objects.requireNonNull(edgePolicy, "edgePolicy");
        this.stats = stats;
    }

    public EdgePolicy getEdgePolicy() {
        return edgePolicy;
    }

    /**
     * Scale by the given factor.
     */
    public PixelImage scale(PixelImage original, ScaleFactor factor) {
        Objects.requireNonNull(factor, "factor");
        return switch (factor) {
            case X2 -> scale2x(original);
            case X3 -> scale3x(original);
        };
    }

    /**
     * Double the size of an image.
     *
     * <pre>
     * source      output
     *  . a .       1 2
     *  c p b       3 4
     *  . d .
     * </pre>
     */
    public PixelImage scale2x(PixelImage original) {
        PixelImage result = original.createBlank(original.getWidth() << 1, original.getHeight() << 1);

        for (int y = 0; y < original.getHeight(); y++) {
            for (int x = 0; x < original.getWidth(); x++) {
                int p = original.getPixel(x, y);
                int a = edgePolicy.read(original, x, y - 1);
                int b = edgePolicy.read(original, x + 1, y);
                int c = edgePolicy.read(original, x - 1, y);
                int d = edgePolicy.read(original, x, y + 1);

                int ox = x << 1;
                int oy = y << 1;
                result.setPixel(ox, oy, c == a && c != d && a != b ? a : p);
                result.setPixel(ox + 1, oy, a == b && a != c && b != d ? b : p);
                result.setPixel(ox, oy + 1, d == c && d != b && c != a ? c : p);
                result.setPixel(ox + 1, oy + 1, b == d && b != a && d != c ? d : p);
            }
        }

        if (stats != null) stats.recordScale2x();
        return result;
    }

    /**
     * Triple the size of an image.
     *
     * <pre>
     * source      output
     *  a b c       0 1 2
     *  d e f       3 4 5
     *  g h i       6 7 8
     * </pre>
     */
    public PixelImage scale3x(PixelImage original) {
        PixelImage result = original.createBlank(original.getWidth() * 3, original.getHeight() * 3);

        for (int y = 0; y < original.getHeight(); y++) {
            for (int x = 0; x < original.getWidth(); x++) {
                int a = edgePolicy.read(original, x - 1, y - 1);
                int b = edgePolicy.read(original, x, y - 1);
                int c = edgePolicy.read(original, x + 1, y - 1);
                int d = edgePolicy.read(original, x - 1, y);
                int e = original.getPixel(x, y);
                int f = edgePolicy.read(original, x + 1, y);
                int g = edgePolicy.read(original, x - 1, y + 1);
                int h = edgePolicy.read(original, x, y + 1);
                int i = edgePolicy.read(original, x + 1, y + 1);

                // Each corner is "open" when its two edge neighbors match
                // and the opposite neighbors break the pattern.
                boolean topLeft = d == b && b != f && d != h;
                boolean topRight = b == f && b != d && f != h;
                boolean bottomLeft = d == h && d != b && h != f;
                boolean bottomRight = h == f && d != h && b != f;

                int ox = x * 3;
                int oy = y * 3;
                result.setPixel(ox, oy, topLeft ? d : e);
                result.setPixel(ox + 1, oy, (topLeft && e != c) || (topRight && e != a) ? b : e);
                result.setPixel(ox + 2, oy, topRight ? f : e);
                result.setPixel(ox, oy + 1, (topLeft && e != g) || (bottomLeft && e != a) ? d : e);
                result.setPixel(ox + 1, oy + 1, e);
                result.setPixel(ox + 2, oy + 1, (topRight && e != i) || (bottomRight && e != c) ? f : e);
                result.setPixel(ox, oy + 2, bottomLeft ? d : e);
                result.setPixel(ox + 1, oy + 2, (bottomLeft && e != i) || (bottomRight && e != g) ? h : e);
                result.setPixel(ox + 2, oy + 2, bottomRight ? f : e);
            }
        }

        if (stats != null) stats.recordScale3x();
        return result;
    }
}
