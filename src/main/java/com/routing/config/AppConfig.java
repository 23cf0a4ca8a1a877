package com.routing.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Properties;

public class AppConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final Properties properties = new Properties();

    public static final int DEFAULT_PROGRESS_INTERVAL = 100_000;

    static {
        try (InputStream input = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (input == null) {
                throw new RuntimeException("Unable to find application.properties");
            }
            properties.load(input);
        } catch (IOException e) {
            logger.error("Failed to load configuration", e);
            throw new RuntimeException("Failed to load configuration", e);
        }
    }

    private AppConfig() {
    }

    /**
     * Number of groups between two progress notices.
     */
    public static int getProgressInterval() {
        return Integer.parseInt(properties.getProperty("progress.interval",
            String.valueOf(DEFAULT_PROGRESS_INTERVAL)).trim());
    }

    public static Charset getInputCharset() {
        return Charset.forName(properties.getProperty("input.charset", "UTF-8").trim());
    }
}
