package io.github.tclast.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Limits and output options for one analyzer instance.
 *
 * <p>{@code maxDelimiterDepth} bounds the open-delimiter stack of the tokenizer; past it the rest of the input is
 * taken literally. {@code maxBodyDepth} bounds recursion into nested script bodies; past it the builder emits a
 * {@code depth_exceeded} error instead of descending. It may not exceed {@link #MAX_BODY_DEPTH}: building recurses a
 * few frames per body level and lowering to JSON recurses once more per level, and both must fit on an ordinary
 * thread stack.
 */
public record ParserConfig(int maxDelimiterDepth, int maxBodyDepth, boolean prettyPrint) {
    private static final Logger logger = LogManager.getLogger(ParserConfig.class);

    public static final int DEFAULT_MAX_DELIMITER_DEPTH = 10_000;
    public static final int DEFAULT_MAX_BODY_DEPTH = 256;
    public static final int MAX_BODY_DEPTH = 256;

    public static final String RESOURCE_NAME = "tclast.properties";
    public static final String KEY_MAX_DELIMITER_DEPTH = "tclast.maxDelimiterDepth";
    public static final String KEY_MAX_BODY_DEPTH = "tclast.maxBodyDepth";
    public static final String KEY_PRETTY_PRINT = "tclast.prettyPrint";

    public ParserConfig {
        if (maxDelimiterDepth < 1 || maxBodyDepth < 1) {
            throw new IllegalArgumentException(
                    "Depth limits must be positive, got delimiter=" + maxDelimiterDepth + " body=" + maxBodyDepth);
        }
        if (maxBodyDepth > MAX_BODY_DEPTH) {
            throw new IllegalArgumentException(
                    "maxBodyDepth must be at most " + MAX_BODY_DEPTH + ", got " + maxBodyDepth);
        }
    }

    public static ParserConfig defaults() {
        return new ParserConfig(DEFAULT_MAX_DELIMITER_DEPTH, DEFAULT_MAX_BODY_DEPTH, false);
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the classpath, if present, then lets {@code tclast.*} system properties
     * override it.
     */
    public static ParserConfig load() {
        var props = new Properties();
        try (InputStream in = ParserConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {} from classpath: {}", RESOURCE_NAME, e.getMessage());
        }
        for (var key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("tclast.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    /** Missing or invalid values fall back to the defaults. */
    public static ParserConfig fromProperties(Properties props) {
        return new ParserConfig(
                getPositiveInt(props, KEY_MAX_DELIMITER_DEPTH, DEFAULT_MAX_DELIMITER_DEPTH, Integer.MAX_VALUE),
                getPositiveInt(props, KEY_MAX_BODY_DEPTH, DEFAULT_MAX_BODY_DEPTH, MAX_BODY_DEPTH),
                getBoolean(props, KEY_PRETTY_PRINT, false));
    }

    public ParserConfig withMaxDelimiterDepth(int depth) {
        return new ParserConfig(depth, maxBodyDepth, prettyPrint);
    }

    public ParserConfig withMaxBodyDepth(int depth) {
        return new ParserConfig(maxDelimiterDepth, depth, prettyPrint);
    }

    public ParserConfig withPrettyPrint(boolean pretty) {
        return new ParserConfig(maxDelimiterDepth, maxBodyDepth, pretty);
    }

    private static int getPositiveInt(Properties props, String key, int defVal, int max) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defVal;
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed > max) {
                logger.warn("Capping {}={} at {}", key, raw, max);
                return max;
            }
            if (parsed > 0) {
                return parsed;
            }
            logger.warn("Ignoring non-positive {}={}, using {}", key, raw, defVal);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}='{}', using {}", key, raw, defVal);
        }
        return defVal;
    }

    private static boolean getBoolean(Properties props, String key, boolean def) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        return Boolean.parseBoolean(raw.trim());
    }
}
