package com.spritefx.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.spritefx.image.Palette;
import com.spritefx.scale.EdgePolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Settings for the transform library, read from JSON.
 *
 * <pre>
 * {
 *   "image":    { "background_color": 0 },
 *   "scaling":  { "edge_policy": "background" },
 *   "rotation": { "warn_tracked_sprites": 1024 }
 * }
 * </pre>
 *
 * Missing or invalid values fall back to defaults with a warning; loading
 * never fails.
 */
public class TransformConfig {

    /** Classpath resource read by {@link #loadDefault(Logger)}. */
    public static final String DEFAULT_RESOURCE = "sprite-transforms.json";

    public static final int DEFAULT_WARN_TRACKED_SPRITES = 1024;
    public static final int MAX_WARN_TRACKED_SPRITES = 1_000_000;

    private int backgroundColor = Palette.TRANSPARENT;
    private EdgePolicy edgePolicy = EdgePolicy.BACKGROUND;
    private int warnTrackedSprites = DEFAULT_WARN_TRACKED_SPRITES;

    public TransformConfig() {
    }

    /**
     * Configuration with every value at its default.
     */
    public static TransformConfig defaults() {
        return new TransformConfig();
    }

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath, or defaults if absent.
     */
    public static TransformConfig loadDefault(Logger logger) {
        InputStream in = TransformConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            logger.info("No " + DEFAULT_RESOURCE + " found, using default settings.");
            return defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, logger);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read " + DEFAULT_RESOURCE + ", using default settings", e);
            return defaults();
        }
    }

    /**
     * Parse configuration from a reader.
     */
    public static TransformConfig load(Reader reader, Logger logger) {
        try {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                logger.warning("Transform config is not a JSON object, using default settings.");
                return defaults();
            }
            return fromJson(root.getAsJsonObject(), logger);
        } catch (JsonParseException e) {
            logger.log(Level.WARNING, "Malformed transform config, using default settings", e);
            return defaults();
        }
    }

    /**
     * Parse configuration from a JSON string.
     */
    public static TransformConfig parse(String json, Logger logger) {
        return load(new StringReader(json), logger);
    }

    /**
     * Read settings from an already-parsed JSON object.
     */
    public static TransformConfig fromJson(JsonObject root, Logger logger) {
        TransformConfig config = new TransformConfig();

        JsonObject image = section(root, "image", logger);
        if (image != null && image.has("background_color")) {
            int value = readInt(image, "background_color", Palette.TRANSPARENT, logger);
            if (!Palette.isValidIndex(value)) {
                logger.warning("image.background_color " + value + " is outside 0-" + Palette.MAX_INDEX
                    + ", clamped.");
                value = Math.max(0, Math.min(Palette.MAX_INDEX, value));
            }
            config.backgroundColor = value;
        }

        JsonObject scaling = section(root, "scaling", logger);
        if (scaling != null && scaling.has("edge_policy")) {
            String key = readString(scaling, "edge_policy", logger);
            EdgePolicy policy = EdgePolicy.fromKey(key);
            if (policy == null) {
                logger.warning("Unknown scaling.edge_policy '" + key + "', using '"
                    + EdgePolicy.BACKGROUND.key() + "'.");
                policy = EdgePolicy.BACKGROUND;
            }
            config.edgePolicy = policy;
        }

        JsonObject rotation = section(root, "rotation", logger);
        if (rotation != null && rotation.has("warn_tracked_sprites")) {
            int value = readInt(rotation, "warn_tracked_sprites", DEFAULT_WARN_TRACKED_SPRITES, logger);
            if (value < 1 || value > MAX_WARN_TRACKED_SPRITES) {
                logger.warning("rotation.warn_tracked_sprites " + value + " is outside 1-"
                    + MAX_WARN_TRACKED_SPRITES + ", clamped.");
                value = Math.max(1, Math.min(MAX_WARN_TRACKED_SPRITES, value));
            }
            config.warnTrackedSprites = value;
        }

        return config;
    }

    private static JsonObject section(JsonObject root, String name, Logger logger) {
        JsonElement element = root.get(name);
        if (element == null || element.isJsonNull()) return null;
        if (!element.isJsonObject()) {
            logger.warning("Config section '" + name + "' is not an object, ignored.");
            return null;
        }
        return element.getAsJsonObject();
    }

    private static int readInt(JsonObject section, String key, int defaultVal, Logger logger) {
        JsonElement element = section.get(key);
        try {
            return element.getAsInt();
        } catch (UnsupportedOperationException | NumberFormatException | IllegalStateException e) {
            logger.warning("Config value '" + key + "' is not an integer: " + element + ", using " + defaultVal);
            return defaultVal;
        }
    }

    private static String readString(JsonObject section, String key, Logger logger) {
        JsonElement element = section.get(key);
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        logger.warning("Config value '" + key + "' is not a string: " + element);
        return null;
    }

    public int getBackgroundColor() { return backgroundColor; }
    public void setBackgroundColor(int backgroundColor) { this.backgroundColor = backgroundColor; }

    public EdgePolicy getEdgePolicy() { return edgePolicy; }
    public void setEdgePolicy(EdgePolicy edgePolicy) { this.edgePolicy = edgePolicy; }

    public int getWarnTrackedSprites() { return warnTrackedSprites; }
    public void setWarnTrackedSprites(int warnTrackedSprites) { this.warnTrackedSprites = warnTrackedSprites; }
}
