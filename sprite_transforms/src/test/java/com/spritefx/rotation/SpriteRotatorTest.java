package com.spritefx.rotation;

import com.spritefx.entities.TransformStats;
import com.spritefx.image.IndexedImage;
import com.spritefx.image.PixelImage;
import com.spritefx.scale.PixelScaler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the rotation algorithm: right-angle permutations and sampled angles.
 */
class SpriteRotatorTest {

    private static final String WIDE = """
        1 2 3
        4 5 6
        """;

    private static final String ARROW = """
        . . 3 .
        . 3 3 3
        3 . 3 .
        . . 3 .
        """;

    private final PixelScaler scaler = new PixelScaler();
    private final TransformStats stats = new TransformStats();
    private final SpriteRotator rotator = new SpriteRotator(stats);

    private RotationState stateOf(String literal) {
        return new RotationState(1, IndexedImage.parse(literal), scaler, 0);
    }

    @Nested
    @DisplayName("Right angles")
    class RightAngles {

        @Test
        @DisplayName("0 degrees returns an equal, independent copy")
        void zeroIsCopy() {
            RotationState state = stateOf(ARROW);
            PixelImage rotated = rotator.rotate(state, 0);

            assertEquals(state.getOriginalImage(), rotated);
            assertNotSame(state.getOriginalImage(), rotated);

            rotated.setPixel(0, 0, 9);
            assertEquals(0, state.getOriginalImage().getPixel(0, 0));
        }

        @Test
        @DisplayName("90 degrees turns a 3x2 image into the exact 2x3 permutation")
        void quarterTurnFixture() {
            PixelImage rotated = rotator.rotate(stateOf(WIDE), 90);

            assertEquals(IndexedImage.parse("""
                4 1
                5 2
                6 3
                """), rotated);
        }

        @Test
        @DisplayName("180 degrees keeps the size and reverses both axes")
        void halfTurnFixture() {
            PixelImage rotated = rotator.rotate(stateOf(WIDE), 180);

            assertEquals(IndexedImage.parse("""
                6 5 4
                3 2 1
                """), rotated);
        }

        @Test
        @DisplayName("270 degrees turns counter-clockwise")
        void threeQuarterTurnFixture() {
            PixelImage rotated = rotator.rotate(stateOf(WIDE), 270);

            assertEquals(IndexedImage.parse("""
                3 6
                2 5
                1 4
                """), rotated);
        }

        @Test
        @DisplayName("-90 degrees equals 270 degrees")
        void negativeQuarterTurn() {
            RotationState state = stateOf(WIDE);
            assertEquals(rotator.rotate(state, 270), rotator.rotate(state, -90));
        }

        @Test
        @DisplayName("Four quarter turns return the original")
        void fourQuarterTurns() {
            IndexedImage image = IndexedImage.parse(ARROW);
            PixelImage current = image;
            for (int i = 0; i < 4; i++) {
                current = rotator.rotate(new RotationState(1, current, scaler, 0), 90);
            }
            assertEquals(image, current);
        }

        @ParameterizedTest
        @ValueSource(ints = {360, 720, -360, -1080, 3600})
        @DisplayName("Whole turns equal 0 degrees")
        void wholeTurnsEqualZero(int degrees) {
            RotationState state = stateOf(ARROW);
            assertEquals(rotator.rotate(state, 0), rotator.rotate(state, degrees));
        }

        @Test
        @DisplayName("Right angles use the fast path")
        void rightAnglesCountedAsFastPath() {
            RotationState state = stateOf(WIDE);
            rotator.rotate(state, 0);
            rotator.rotate(state, 90);
            rotator.rotate(state, -180);
            rotator.rotate(state, 630);

            assertEquals(4, stats.getFastPathRotations());
            assertEquals(0, stats.getSampledRotations());
        }
    }

    @Nested
    @DisplayName("Sampled angles")
    class SampledAngles {

        @Test
        @DisplayName("45 degrees on 4x4 only samples inside the 8x8 buffer")
        void fortyFiveDegreeFixture() {
            IndexedImage solid = new IndexedImage(4, 4);
            for (int y = 0; y < 4; y++) {
                for (int x = 0; x < 4; x++) {
                    solid.setPixel(x, y, 7);
                }
            }
            RotationState state = new RotationState(1, solid, scaler, 0);
            assertEquals(8, state.getSupersampledImage().getWidth());
            assertEquals(8, state.getSupersampledImage().getHeight());

            PixelImage rotated = rotator.rotate(state, 45);

            assertEquals(4, rotated.getWidth());
            assertEquals(4, rotated.getHeight());
            // These two corners map outside the supersampled buffer.
            assertEquals(0, rotated.getPixel(0, 0));
            assertEquals(0, rotated.getPixel(0, 3));
            assertEquals(7, rotated.getPixel(3, 3));
            assertEquals(7, rotated.getPixel(3, 0));
            assertEquals(7, rotated.getPixel(2, 2));
            assertEquals(IndexedImage.parse("""
                . 7 7 7
                7 7 7 7
                7 7 7 7
                . 7 7 7
                """), rotated);
        }

        @Test
        @DisplayName("Sampled output keeps the original size and background")
        void keepsSizeAndBackground() {
            IndexedImage image = new IndexedImage(5, 3, 4);
            image.setPixel(2, 1, 1);
            PixelImage rotated = rotator.rotate(new RotationState(1, image, scaler, 0), 30);

            assertEquals(5, rotated.getWidth());
            assertEquals(3, rotated.getHeight());
            assertEquals(4, rotated.getBackground());
        }

        @Test
        @DisplayName("Sampled output only holds source colors or background")
        void noBlending() {
            RotationState state = stateOf(ARROW);
            for (int degrees = 1; degrees < 360; degrees += 7) {
                PixelImage rotated = rotator.rotate(state, degrees);
                for (int y = 0; y < rotated.getHeight(); y++) {
                    for (int x = 0; x < rotated.getWidth(); x++) {
                        int color = rotated.getPixel(x, y);
                        assertTrue(color == 0 || color == 3,
                            "color " + color + " at (" + x + ", " + y + ") for " + degrees + " degrees");
                    }
                }
            }
        }

        @Test
        @DisplayName("Center pixel is preserved at any sampled angle")
        void centerPreserved() {
            RotationState state = stateOf(ARROW);
            for (int degrees = 15; degrees < 360; degrees += 15) {
                if (degrees % 90 == 0) continue;
                assertEquals(3, rotator.rotate(state, degrees).getPixel(2, 2), degrees + " degrees");
            }
        }

        @Test
        @DisplayName("Sampled rotations are counted")
        void sampledCounted() {
            RotationState state = stateOf(ARROW);
            rotator.rotate(state, 30);
            rotator.rotate(state, -45);

            assertEquals(2, stats.getSampledRotations());
            assertEquals(2, stats.getTotalRotations());
        }

        @Test
        @DisplayName("Rotating does not modify the state")
        void stateUntouched() {
            RotationState state = stateOf(ARROW);
            PixelImage original = state.getOriginalImage().copy();
            PixelImage supersampled = state.getSupersampledImage().copy();

            rotator.rotate(state, 33);

            assertEquals(original, state.getOriginalImage());
            assertEquals(supersampled, state.getSupersampledImage());
            assertEquals(0, state.getAngle());
        }
    }
}
