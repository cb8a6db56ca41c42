package net.vcc.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Configuration backed by a Java properties file.
 */
public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        this.base = base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static PropertiesConfiguration load(InputStream in)
            throws IOException {
        Properties props = new Properties();
        props.load(in);
        return new PropertiesConfiguration(props);
    }

    public static PropertiesConfiguration load(File path)
            throws IOException {
        InputStream in = new FileInputStream(path);
        try {
            return load(in);
        } finally {
            in.close();
        }
    }

}
