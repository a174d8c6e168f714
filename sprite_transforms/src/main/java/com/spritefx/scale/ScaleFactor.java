package com.spritefx.scale;

/**
 * Supported up-scaling factors with stable keys for configuration.
 */
public enum ScaleFactor {
    X2("2x", 2),
    X3("3x", 3);

    private final String key;
    private final int multiplier;

    ScaleFactor(String key, int multiplier) {
        this.key = key;
        this.multiplier = multiplier;
    }

    public String key() {
        return key;
    }

    public int multiplier() {
        return multiplier;
    }

    public static ScaleFactor fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (ScaleFactor factor : values()) {
            if (factor.key.equalsIgnoreCase(key.trim())) {
                return factor;
            }
        }
        return null;
    }
}
