package com.spritefx.scale;

import com.spritefx.image.PixelImage;

/**
 * How the scalers resolve neighbor reads that fall outside the source image.
 */
public enum EdgePolicy {
    /** Read the image background, so sprite outlines get rounded corners. */
    BACKGROUND("background"),
    /** Repeat the nearest edge pixel, as the reference Scale2x/Scale3x do. */
    CLAMP("clamp");

    private final String key;

    EdgePolicy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Read a neighbor of an image pixel under this policy.
     */
    public int read(PixelImage image, int x, int y) {
        if (this == CLAMP && image.getWidth() > 0 && image.getHeight() > 0) {
            x = Math.max(0, Math.min(image.getWidth() - 1, x));
            y = Math.max(0, Math.min(image.getHeight() - 1, y));
        }
        return image.getPixel(x, y);
    }

    public static EdgePolicy fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (EdgePolicy policy : values()) {
            if (policy.key.equalsIgnoreCase(key.trim())) {
                return policy;
            }
        }
        return null;
    }
}
