package net.synchro.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        if (base == null)
            throw new NullPointerException("Properties may not be null");
        this.base = base;
    }
    public PropertiesConfiguration(File path) {
        this(loadProperties(path));
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(File path) {
        try {
            InputStream in = new FileInputStream(path);
            try {
                return loadProperties(in);
            } finally {
                in.close();
            }
        } catch (IOException exc) {
            throw new RuntimeException("Could not load configuration from " +
                path, exc);
        }
    }
    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        ret.load(in);
        return ret;
    }

    /* Returns null if there is no such resource. */
    public static PropertiesConfiguration fromResource(String name,
                                                       ClassLoader loader) {
        if (loader == null) loader = ClassLoader.getSystemClassLoader();
        InputStream in = loader.getResourceAsStream(name);
        if (in == null) return null;
        try {
            try {
                return new PropertiesConfiguration(loadProperties(in));
            } finally {
                in.close();
            }
        } catch (IOException exc) {
            throw new RuntimeException("Could not load configuration " +
                "resource " + name, exc);
        }
    }

}
