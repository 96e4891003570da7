package net.synchro.util.config;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Helpers for interpreting textual configuration values.
 * Malformed values are logged and replaced by the given default.
 */
public final class Configurations {

    private static final Logger LOGGER = Logger.getLogger("Configurations");

    private Configurations() {}

    /**
     * Return whether the string represents an affirmative value.
     * Accepts inputs such as "1", "y", "yes", "on" (ignoring case) as true.
     */
    public static boolean isTrue(String s) {
        if (s == null) return false;
        return (Boolean.parseBoolean(s) || s.equalsIgnoreCase("1") ||
            s.equalsIgnoreCase("y") || s.equalsIgnoreCase("yes") ||
            s.equalsIgnoreCase("on"));
    }

    public static boolean getBoolean(Configuration cfg, String key,
                                     boolean def) {
        String value = cfg.get(key);
        if (value == null || value.trim().isEmpty()) return def;
        return isTrue(value.trim());
    }

    public static int getInt(Configuration cfg, String key, int def) {
        String value = cfg.get(key);
        if (value == null || value.trim().isEmpty()) return def;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Invalid integer " + value + " for " + key +
                "; using " + def);
            return def;
        }
    }

    /* Enum constants are matched ignoring case. */
    public static <E extends Enum<E>> E getEnum(Configuration cfg, String key,
                                                Class<E> cls, E def) {
        String value = cfg.get(key);
        if (value == null || value.trim().isEmpty()) return def;
        try {
            return Enum.valueOf(cls, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exc) {
            LOGGER.warning("Invalid value " + value + " for " + key +
                "; using " + def);
            return def;
        }
    }

}
