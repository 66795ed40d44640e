package com.danieljhkim.distkv.kvcommon.config;

import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_PATH = "distkv-client.yml";

    /**
     * Gets the config file path from DISTKV_CONFIG_PATH environment variable,
     * defaulting to "distkv-client.yml" if not set.
     */
    public static String getConfigFilePath() {
        String appConfigPath = System.getenv("DISTKV_CONFIG_PATH");
        if (appConfigPath == null || appConfigPath.isEmpty()) {
            appConfigPath = DEFAULT_CONFIG_PATH;
        }
        return appConfigPath;
    }

    /**
     * Loads the client configuration using the path from DISTKV_CONFIG_PATH
     * environment variable, defaulting to "distkv-client.yml" if not set.
     */
    public static AppConfig load() throws IOException {
        return load(getConfigFilePath());
    }

    /**
     * Loads the client configuration from the specified classpath resource.
     * Sections missing from the file keep their defaults.
     */
    public static AppConfig load(String yamlResourcePath) throws IOException {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(AppConfig.class, loaderOptions);
        Yaml yaml = new Yaml(constructor);

        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(yamlResourcePath)) {

            if (in == null) {
                throw new IOException("Config file not found on classpath: " + yamlResourcePath);
            }
            AppConfig config = yaml.load(in);
            if (config == null) {
                config = new AppConfig();
            }
            logger.info("Loaded client configuration from {}: {}", yamlResourcePath, config);
            return config;
        }
    }
}
