package net.vcc.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered configuration.
 * Explicitly set values take precedence; otherwise, the sources are
 * consulted in the order they were added and the first non-null value
 * wins. Looked-up values are not cached, so later changes to the sources
 * are observed.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(toEnvironmentName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        for (Configuration src : sources) {
            String ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    public String get(String key, String defaultValue) {
        String ret = get(key);
        return (ret == null) ? defaultValue : ret;
    }

    /**
     * Return the integer value of key, or defaultValue if it is not set.
     * A set but malformed value raises an IllegalArgumentException naming
     * the key.
     */
    public int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid integer value \"" +
                value + "\" for configuration key " + key, exc);
        }
    }

    public void put(String key, String value) {
        data.put(key, value);
    }

    public void remove(String key) {
        data.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }

    public static String toEnvironmentName(String key) {
        return key.toUpperCase().replace(".", "_");
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
