package com.spritefx.rotation;

import com.spritefx.entities.TransformStats;
import com.spritefx.geometry.Point;
import com.spritefx.geometry.PolarVector;
import com.spritefx.image.PixelImage;

/**
 * Computes rotated sprite images from a {@link RotationState}.
 *
 * <p>Positive angles turn clockwise on screen. Multiples of 90 degrees are
 * exact pixel permutations of the original. Any other angle maps each output
 * pixel back onto the 2x supersampled image and takes the nearest sample;
 * samples that land outside it leave the output pixel at its background.
 */
public class SpriteRotator {

    private final TransformStats stats;

    public SpriteRotator() {
        this(null);
    }

    /**
     * @param stats counters to record into, or null
     */
    public SpriteRotator(TransformStats stats) {
        this.stats = stats;
    }

    /**
     * Rotate a sprite's original image.
     *
     * @param state   sprite state holding the original and supersampled images
     * @param degrees any angle; wrapped into [0, 360)
     * @return a new image; the state is not modified
     */
    public PixelImage rotate(RotationState state, int degrees) {
        int angle = Angles.normalize(degrees);
        PixelImage original = state.getOriginalImage();

        PixelImage rotated = switch (angle) {
            case 0 -> original.copy();
            case 90 -> quarterTurn(original);
            case 180 -> halfTurn(original);
            case 270 -> threeQuarterTurn(original);
            default -> null;
        };
        if (rotated != null) {
            if (stats != null) stats.recordFastPathRotation();
            return rotated;
        }

        rotated = sample(original, state.getSupersampledImage(), Angles.toRadians(angle));
        if (stats != null) stats.recordSampledRotation();
        return rotated;
    }

    private static PixelImage quarterTurn(PixelImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        PixelImage out = src.createBlank(h, w);
        for (int y = 0; y < w; y++) {
            for (int x = 0; x < h; x++) {
                out.setPixel(x, y, src.getPixel(y, h - 1 - x));
            }
        }
        return out;
    }

    private static PixelImage halfTurn(PixelImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        PixelImage out = src.createBlank(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out.setPixel(x, y, src.getPixel(w - 1 - x, h - 1 - y));
            }
        }
        return out;
    }

    private static PixelImage threeQuarterTurn(PixelImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        PixelImage out = src.createBlank(h, w);
        for (int y = 0; y < w; y++) {
            for (int x = 0; x < h; x++) {
                out.setPixel(x, y, src.getPixel(w - 1 - y, x));
            }
        }
        return out;
    }

    private static PixelImage sample(PixelImage original, PixelImage supersampled, double radians) {
        PixelImage out = original.createBlank(original.getWidth(), original.getHeight());
        Point center = Point.centerOf(original.getWidth(), original.getHeight());

        for (int y = 0; y < out.getHeight(); y++) {
            for (int x = 0; x < out.getWidth(); x++) {
                // Inverse mapping: turn the destination offset back onto the source.
                Point source = PolarVector.between(center, new Point(x, y))
                    .turn(-radians)
                    .toPoint(center, RotationState.SUPERSAMPLE_FACTOR);

                if (supersampled.contains(source.x(), source.y())) {
                    out.setPixel(x, y, supersampled.getPixel(source.x(), source.y()));
                }
            }
        }
        return out;
    }
}
