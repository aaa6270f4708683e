package com.netbet.bybit.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads BYBIT_API_KEY / BYBIT_API_SECRET (and anything else) from a .env file when present,
 * as System properties so application.yml placeholders resolve.
 * Existing system properties are never overridden.
 */
@Configuration
public class EnvConfig {

    private static final Logger log = LoggerFactory.getLogger(EnvConfig.class);
    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    @Value("${bybit.env-path:.env}")
    private String envPath;

    @PostConstruct
    public void loadEnvIfPresent() {
        int count = load(Path.of(envPath));
        if (count > 0) {
            log.info("Loaded {} keys from {}", count, envPath);
        }
    }

    /** @return number of properties set */
    static int load(Path path) {
        if (!Files.isRegularFile(path)) {
            log.debug("No .env file at {} (optional)", path);
            return 0;
        }
        int count = 0;
        try {
            for (String line : Files.readAllLines(path)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                Matcher m = ENV_LINE.matcher(trimmed);
                if (!m.matches()) continue;
                String key = m.group(1);
                String value = unquote(m.group(2).trim());
                if (System.getProperty(key) == null) {
                    System.setProperty(key, value);
                    count++;
                }
            }
        } catch (IOException e) {
            log.warn("Could not read .env at {}: {}", path, e.getMessage());
        }
        return count;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"");
        }
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
