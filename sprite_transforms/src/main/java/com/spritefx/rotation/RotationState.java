package com.spritefx.rotation;

import com.spritefx.image.PixelImage;
import com.spritefx.scale.PixelScaler;

/**
 * Rotation bookkeeping for one sprite.
 *
 * <p>Holds a private copy of the sprite's image as it was when the sprite was
 * first rotated, plus a Scale2x copy of it that rotations sample from. Both
 * are computed once here and never refreshed; the engine replaces the whole
 * state when a sprite's source image changes.
 */
public class RotationState {

    /** Size of the supersampled image relative to the original. */
    public static final int SUPERSAMPLE_FACTOR = 2;

    private final int spriteId;
    private final PixelImage originalImage;
    private final PixelImage supersampledImage;
    private int angle;

    RotationState(int spriteId, PixelImage source, PixelScaler scaler, int angle) {
        this.spriteId = spriteId;
        this.originalImage = source.copy();
        this.supersampledImage = scaler.scale2x(originalImage);
        this.angle = angle;
    }

    public int getSpriteId() {
        return spriteId;
    }

    /**
     * Accumulated angle in degrees as last set, not normalized.
     */
    public int getAngle() {
        return angle;
    }

    void setAngle(int angle) {
        this.angle = angle;
    }

    /**
     * Accumulated angle wrapped into [0, 360).
     */
    public int getNormalizedAngle() {
        return Angles.normalize(angle);
    }

    PixelImage getOriginalImage() {
        return originalImage;
    }

    PixelImage getSupersampledImage() {
        return supersampledImage;
    }
}
