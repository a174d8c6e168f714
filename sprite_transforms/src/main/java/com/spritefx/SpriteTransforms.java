package com.spritefx;

import com.spritefx.config.TransformConfig;
import com.spritefx.entities.TransformStats;
import com.spritefx.entities.TransformableSprite;
import com.spritefx.image.IndexedImage;
import com.spritefx.image.PixelImage;
import com.spritefx.rotation.RotationEngine;
import com.spritefx.rotation.SpriteRotator;
import com.spritefx.scale.PixelScaler;
import com.spritefx.scale.ScaleFactor;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point for hosts: sprite rotation and EPX up-scaling behind one object.
 *
 * <p>Each instance owns its own rotation registry, so separate game instances
 * (or tests) never see each other's sprites. Like the registry, an instance
 * is meant to be driven from a single update thread.
 */
public class SpriteTransforms {

    private final Logger logger;
    private final TransformConfig config;
    private final TransformStats stats;
    private final PixelScaler scaler;
    private final RotationEngine rotationEngine;

    /**
     * Create an instance configured from the bundled {@value TransformConfig#DEFAULT_RESOURCE}.
     */
    public static SpriteTransforms create() {
        Logger logger = Logger.getLogger("SpriteTransforms");
        return new SpriteTransforms(TransformConfig.loadDefault(logger), logger);
    }

    public SpriteTransforms(TransformConfig config, Logger logger) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.stats = new TransformStats();
        this.scaler = new PixelScaler(config.getEdgePolicy(), stats);
        this.rotationEngine = new RotationEngine(logger, scaler, new SpriteRotator(stats),
            config.getWarnTrackedSprites());

        logger.info("Sprite transforms ready (edge policy '" + config.getEdgePolicy().key()
            + "', background " + config.getBackgroundColor() + ")");
    }

    // --- Rotation ---

    /**
     * Rotate a sprite by a number of degrees. Positive values turn clockwise.
     */
    public void changeRotation(TransformableSprite sprite, int deltaDegrees) {
        rotationEngine.changeRotation(sprite, deltaDegrees);
    }

    /**
     * Rotate a sprite to an absolute angle. Positive values turn clockwise.
     */
    public void rotateTo(TransformableSprite sprite, int degrees) {
        rotationEngine.rotateTo(sprite, degrees);
    }

    /**
     * Current angle of a sprite in [0, 360), or 0 if it was never rotated.
     */
    public int getRotation(TransformableSprite sprite) {
        return rotationEngine.getRotation(sprite);
    }

    /**
     * Host notification that a sprite was destroyed; releases its rotation state.
     */
    public void onSpriteDestroyed(int spriteId) {
        rotationEngine.forget(spriteId);
    }

    /**
     * Pick up a sprite's new source image while keeping its angle.
     */
    public void refresh(TransformableSprite sprite) {
        rotationEngine.refresh(sprite);
    }

    // --- Scaling ---

    /**
     * Double the size of an image with Scale2x.
     */
    public PixelImage scale2x(PixelImage image) {
        return scaler.scale2x(Objects.requireNonNull(image, "image"));
    }

    /**
     * Triple the size of an image with Scale3x.
     */
    public PixelImage scale3x(PixelImage image) {
        return scaler.scale3x(Objects.requireNonNull(image, "image"));
    }

    public PixelImage scale(PixelImage image, ScaleFactor factor) {
        return scaler.scale(Objects.requireNonNull(image, "image"), factor);
    }

    // --- Images ---

    /**
     * Create a blank image using the configured background color.
     */
    public PixelImage createImage(int width, int height) {
        return new IndexedImage(width, height, config.getBackgroundColor());
    }

    public TransformConfig getConfig() {
        return config;
    }

    public TransformStats getStats() {
        return stats;
    }

    public RotationEngine getRotationEngine() {
        return rotationEngine;
    }

    public Logger getLogger() {
        return logger;
    }
}
