package kgrs.capabilities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Looks up a configuration value in the environment, then in system
 * properties, then in the .env fallback when one is enabled.
 *
 * Reasoner settings live under the {@value #PREFIX} namespace; {@link #setting(String)}
 * accepts either the bare name ("default.namespace", "DEFAULT_NAMESPACE")
 * or the full key ("KGRS_DEFAULT_NAMESPACE").
 */
public final class ConfigResolver {

    public static final String PREFIX = "KGRS_";

    private static Supplier<Map<String, String>> dotenvSupplier = null;

    private ConfigResolver() {}

    public static void enableDotenvFallback(Supplier<Map<String, String>> supplier) {
        dotenvSupplier = supplier;
    }

    public static void disableDotenvFallback() {
        dotenvSupplier = null;
    }

    public static String resolve(String key) {
        String value = System.getenv(key);
        if (isSet(value)) return value;

        value = System.getProperty(key);
        if (isSet(value)) return value;

        if (dotenvSupplier != null) {
            value = dotenvSupplier.get().get(key);
            if (isSet(value)) return value;
        }

        return null;
    }

    public static String resolve(String key, String defaultValue) {
        String value = resolve(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Maps a setting name onto its environment key: upper case, dots and
     * dashes become underscores, and the KGRS_ prefix is added once.
     */
    public static String keyFor(String setting) {
        String key = setting.trim().toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
        return key.startsWith(PREFIX) ? key : PREFIX + key;
    }

    /**
     * @return the trimmed value of a KGRS setting, or null when unset
     */
    public static String setting(String name) {
        String value = resolve(keyFor(name));
        return value != null ? value.trim() : null;
    }

    /**
     * A comma-separated KGRS setting, with blank entries dropped.
     *
     * @return the entries, or an empty list when unset
     */
    public static List<String> settingList(String name) {
        String value = setting(name);
        if (value == null) return Collections.emptyList();
        List<String> entries = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) entries.add(part.trim());
        }
        return entries;
    }

    private static boolean isSet(String v) {
        return v != null && !v.isBlank();
    }
}
