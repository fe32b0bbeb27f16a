package com.github.musiKk.haumea;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import lombok.ToString;

/**
 * Reads {@code haumea.cfg}. The copy on the classpath holds the defaults; a {@code haumea.cfg} in the
 * working directory overrides single keys.
 */
public class ConfigReader {

    static final String CONFIG_FILE = "haumea.cfg";

    static Config readConfig() {
        return readConfig(Path.of(CONFIG_FILE));
    }

    static Config readConfig(Path overrides) {
        Properties properties = new Properties();
        try {
            try (InputStream defaults = ConfigReader.class.getResourceAsStream("/" + CONFIG_FILE)) {
                if (defaults != null) {
                    properties.load(defaults);
                }
            }
            if (Files.exists(overrides)) {
                try (Reader reader = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return fromProperties(properties);
    }

    static Config fromProperties(Properties properties) {
        var config = new Config();

        var indent = properties.getProperty("indent", "4").trim();
        try {
            config.indent = Integer.parseInt(indent);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("indent must be a number, got '" + indent + "'", e);
        }
        if (config.indent < 0) {
            throw new IllegalArgumentException("indent must not be negative, got " + config.indent);
        }

        config.tempPrefix = properties.getProperty("tempPrefix", "__HAUMEA_TEMP_").trim();
        if (!config.tempPrefix.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("tempPrefix must be a C identifier, got '" + config.tempPrefix + "'");
        }

        return config;
    }

    @ToString
    static class Config {
        int indent;
        String tempPrefix;

        public void applyConfig(ConfigTarget ct) {
            ct.setIndent(indent);
            ct.setTempPrefix(tempPrefix);
        }
    }

    interface ConfigTarget {
        void setIndent(int indent);
        void setTempPrefix(String tempPrefix);
    }

}
