package net.synchro.util.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DynamicConfiguration implements Configuration {

    public static final String DEFAULT_RESOURCE = "synchro.properties";

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(envName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public synchronized Map<String, String> getData() {
        return Collections.unmodifiableMap(
            new LinkedHashMap<String, String>(data));
    }

    public synchronized List<Configuration> getSources() {
        return Collections.unmodifiableList(
            new ArrayList<Configuration>(sources));
    }

    /* Explicitly put values take precedence over all sources; values
     * obtained from sources are remembered. */
    public synchronized String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        data.put(key, ret);
        return ret;
    }

    public synchronized void put(String key, String value) {
        data.put(key, value);
    }
    public synchronized void putAll(Map<String, String> values) {
        data.putAll(values);
    }

    public synchronized void remove(String key) {
        data.remove(key);
    }

    public synchronized void addSource(Configuration source) {
        sources.add(source);
    }
    public synchronized void removeSource(Configuration source) {
        sources.remove(source);
    }

    public static String envName(String key) {
        return key.toUpperCase().replace(".", "_");
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        PropertiesConfiguration bundled = PropertiesConfiguration.fromResource(
            DEFAULT_RESOURCE, DynamicConfiguration.class.getClassLoader());
        if (bundled != null) ret.addSource(bundled);
        return ret;
    }

}
