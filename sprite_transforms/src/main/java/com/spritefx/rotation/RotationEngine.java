package com.spritefx.rotation;

import com.spritefx.entities.TransformableSprite;
import com.spritefx.image.PixelImage;
import com.spritefx.scale.PixelScaler;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Tracks rotation state per sprite and pushes rotated images back to sprites.
 *
 * <p>State is created lazily the first time a sprite is rotated: the sprite's
 * current image is copied and supersampled once, and every later rotation is
 * computed from those copies, never from the sprite's live image. Call
 * {@link #refresh} after giving a sprite a new source image.
 *
 * <p>The engine is not thread-safe. Confine each instance to the host's
 * update thread; separate instances share nothing.
 *
 * <p>The host must call {@link #forget(int)} when a sprite is destroyed.
 * Otherwise its state stays registered and a new sprite that reuses the id
 * would be rotated from the old sprite's image.
 */
public class RotationEngine {

    private static final int DEFAULT_WARN_THRESHOLD = 1024;

    private final Logger logger;
    private final PixelScaler scaler;
    private final SpriteRotator rotator;
    private final int warnThreshold;

    // Map: spriteId -> state
    private final Map<Integer, RotationState> states = new HashMap<>();
    private boolean warnedAboutSize = false;

    public RotationEngine(Logger logger) {
        this(logger, new PixelScaler(), new SpriteRotator(), DEFAULT_WARN_THRESHOLD);
    }

    /**
     * @param logger        destination for lifecycle messages
     * @param scaler        produces the supersampled copy of each sprite
     * @param rotator       computes rotated images
     * @param warnThreshold tracked-sprite count above which a warning is logged
     */
    public RotationEngine(Logger logger, PixelScaler scaler, SpriteRotator rotator, int warnThreshold) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.scaler = Objects.requireNonNull(scaler, "scaler");
        this.rotator = Objects.requireNonNull(rotator, "rotator");
        this.warnThreshold = Math.max(1, warnThreshold);
    }

    /**
     * Rotate a sprite by {@code deltaDegrees} relative to its current angle.
     * Positive values turn clockwise.
     */
    public void changeRotation(TransformableSprite sprite, int deltaDegrees) {
        RotationState state = getOrCreateState(sprite);
        applyRotation(sprite, state, Angles.add(state.getAngle(), deltaDegrees));
    }

    /**
     * Rotate a sprite to an absolute angle. Positive values turn clockwise.
     */
    public void rotateTo(TransformableSprite sprite, int degrees) {
        RotationState state = getOrCreateState(sprite);
        applyRotation(sprite, state, degrees);
    }

    /**
     * Get a sprite's angle in [0, 360). Untracked sprites report 0 and stay untracked.
     */
    public int getRotation(TransformableSprite sprite) {
        Objects.requireNonNull(sprite, "sprite");
        return getRotation(sprite.getId());
    }

    /**
     * Get the angle of a sprite id in [0, 360), or 0 if untracked.
     */
    public int getRotation(int spriteId) {
        RotationState state = states.get(spriteId);
        return state == null ? 0 : state.getNormalizedAngle();
    }

    /**
     * Get the state of a sprite id, or null if untracked.
     */
    public RotationState getState(int spriteId) {
        return states.get(spriteId);
    }

    /**
     * Drop the state of a destroyed sprite.
     *
     * @return true if the sprite was tracked
     */
    public boolean forget(int spriteId) {
        RotationState removed = states.remove(spriteId);
        if (removed == null) {
            return false;
        }
        logger.fine("Stopped tracking rotation of sprite " + spriteId);
        if (states.size() <= warnThreshold) {
            warnedAboutSize = false;
        }
        return true;
    }

    /**
     * Re-register a sprite from its current image, keeping its angle (0 for
     * an untracked sprite), and push the image rotated to that angle.
     */
    public void refresh(TransformableSprite sprite) {
        Objects.requireNonNull(sprite, "sprite");
        RotationState previous = states.remove(sprite.getId());
        int angle = previous == null ? 0 : previous.getAngle();
        // The sprite must already hold its new unrotated source image.
        RotationState state = createState(sprite, angle);
        applyRotation(sprite, state, state.getAngle());
    }

    public boolean isTracked(int spriteId) {
        return states.containsKey(spriteId);
    }

    public int getTrackedCount() {
        return states.size();
    }

    public Set<Integer> getTrackedIds() {
        return Collections.unmodifiableSet(states.keySet());
    }

    /**
     * Drop all rotation state.
     */
    public void clear() {
        int count = states.size();
        states.clear();
        warnedAboutSize = false;
        if (count > 0) {
            logger.info("Cleared rotation state of " + count + " sprites");
        }
    }

    private RotationState getOrCreateState(TransformableSprite sprite) {
        Objects.requireNonNull(sprite, "sprite");
        RotationState state = states.get(sprite.getId());
        if (state == null) {
            state = createState(sprite, 0);
        }
        return state;
    }

    private RotationState createState(TransformableSprite sprite, int angle) {
        PixelImage source = Objects.requireNonNull(sprite.getImage(), "sprite image");
        RotationState state = new RotationState(sprite.getId(), source, scaler, angle);
        states.put(sprite.getId(), state);
        logger.fine("Tracking rotation of sprite " + sprite.getId()
            + " (" + source.getWidth() + "x" + source.getHeight() + ")");

        if (states.size() > warnThreshold && !warnedAboutSize) {
            warnedAboutSize = true;
            logger.warning("Rotation state is held for " + states.size() + " sprites (warning threshold "
                + warnThreshold + "); destroyed sprites may not be reported through forget()");
        }
        return state;
    }

    private void applyRotation(TransformableSprite sprite, RotationState state, int degrees) {
        state.setAngle(degrees);
        sprite.setImage(rotator.rotate(state, degrees));
    }
}
