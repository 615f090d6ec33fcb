package io.fullerstack.observables.config;

import io.fullerstack.observables.registry.FailurePolicy;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Layered configuration backed by {@link ResourceBundle}.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>JVM system properties</li>
 *   <li>observables_{scope}.properties (scoped override, if requested and present)</li>
 *   <li>observables.properties (global defaults)</li>
 * </ol>
 *
 * <p>Scopes ride on ResourceBundle's locale fallback: the scope is used as a locale
 * language tag, so it must be 2 to 8 ASCII letters.
 *
 * <pre>
 * # observables.properties
 * registry.failure-policy=FAIL_FAST
 * property.distinct=false
 *
 * # observables_audit.properties
 * registry.failure-policy=ISOLATE
 * </pre>
 *
 * <pre>
 * ObservablesConfig audit = ObservablesConfig.forScope("audit");
 * audit.failurePolicy();   // ISOLATE
 * </pre>
 */
public class ObservablesConfig {

    public static final String FAILURE_POLICY = "registry.failure-policy";
    public static final String PROPERTY_DISTINCT = "property.distinct";

    private static final String BUNDLE = "observables";
    private static final Pattern SCOPE = Pattern.compile("[A-Za-z]{2,8}");

    private final ResourceBundle bundle;
    private final String context;

    private ObservablesConfig(ResourceBundle bundle, String context) {
        this.bundle = bundle;
        this.context = context;
    }

    /**
     * Global configuration (observables.properties).
     *
     * @return global configuration
     * @throws ConfigurationException if observables.properties is not on the classpath
     */
    public static ObservablesConfig global() {
        return new ObservablesConfig(load(Locale.ROOT), "global");
    }

    /**
     * Scoped configuration, falling back to the global file for keys the scope file lacks
     * or when there is no scope file.
     *
     * @param scope scope name, 2 to 8 letters (e.g. "audit", "ui")
     * @return scoped configuration
     * @throws IllegalArgumentException if scope is not 2 to 8 letters
     */
    public static ObservablesConfig forScope(String scope) {
        Objects.requireNonNull(scope, "scope cannot be null");
        if (!SCOPE.matcher(scope).matches()) {
            throw new IllegalArgumentException("scope must be 2 to 8 letters: '" + scope + "'");
        }
        return new ObservablesConfig(load(Locale.forLanguageTag(scope)), "scope:" + scope.toLowerCase(Locale.ROOT));
    }

    private static ResourceBundle load(Locale locale) {
        try {
            return ResourceBundle.getBundle(BUNDLE, locale, ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
        } catch (MissingResourceException e) {
            throw new ConfigurationException("No " + BUNDLE + ".properties on the classpath", e);
        }
    }

    // =========================================================================
    // Typed getters, system properties first
    // =========================================================================

    /**
     * @param key property key
     * @return the value
     * @throws ConfigurationException if the key is not found
     */
    public String getString(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            throw new ConfigurationException(
                "Missing config key '" + key + "' in context: " + context, e
            );
        }
    }

    public String getString(String key, String defaultValue) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return defaultValue;
        }
    }

    /**
     * @param key property key
     * @return the value as int
     * @throws ConfigurationException if the key is not found or not an int
     */
    public int getInt(String key) {
        return parseInt(key, getString(key));
    }

    /**
     * Reads an int, falling back only when the key is absent.
     *
     * @param key          property key
     * @param defaultValue returned when the key is absent
     * @return the value as int or the default
     * @throws ConfigurationException if the key is present but not an int
     */
    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return parseInt(key, value);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * Reads a boolean. Only "true" and "false" (any case) are accepted.
     *
     * @param key property key
     * @return the value as boolean
     * @throws ConfigurationException if the key is not found or not a boolean
     */
    public boolean getBoolean(String key) {
        return parseBoolean(key, getString(key));
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null ? defaultValue : parseBoolean(key, value);
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new ConfigurationException("Invalid boolean value for key '" + key + "': " + value);
    }

    /**
     * Reads an enum constant by name, ignoring case.
     *
     * @param key          property key
     * @param type         enum type
     * @param defaultValue returned when the key is absent
     * @param <E>          enum type
     * @return the constant
     * @throws ConfigurationException if the value names no constant of the type
     */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Invalid " + type.getSimpleName() + " value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * Configured {@code registry.failure-policy}, defaulting to {@link FailurePolicy#FAIL_FAST}.
     *
     * @return the failure policy
     */
    public FailurePolicy failurePolicy() {
        return getEnum(FAILURE_POLICY, FailurePolicy.class, FailurePolicy.FAIL_FAST);
    }

    public boolean contains(String key) {
        if (System.getProperty(key) != null) {
            return true;
        }
        return bundle.containsKey(key);
    }

    public Set<String> keys() {
        return bundle.keySet();
    }

    /**
     * @return context description, e.g. "global" or "scope:audit"
     */
    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "ObservablesConfig[context=" + context + "]";
    }
}
