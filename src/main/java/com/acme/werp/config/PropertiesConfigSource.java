package com.acme.werp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Classpath defaults from {@value #RESOURCE}, overlaid by an optional operator file.
 * An unreadable source is logged and skipped; the engine then runs on defaults.
 */
public final class PropertiesConfigSource implements ConfigSource {
    private static final Logger logger = LoggerFactory.getLogger(PropertiesConfigSource.class);

    public static final String RESOURCE = "werp-engine.properties";

    private final Path overrideFile;

    public PropertiesConfigSource() { this(null); }

    public PropertiesConfigSource(Path overrideFile) { this.overrideFile = overrideFile; }

    @Override
    public EngineConfig load() {
        Properties props = new Properties();
        try (InputStream in = PropertiesConfigSource.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            logger.warn("Cannot read classpath {}: {}", RESOURCE, e.getMessage());
        }
        if (overrideFile != null) {
            if (Files.isRegularFile(overrideFile)) {
                try (Reader r = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                    props.load(r);
                } catch (IOException e) {
                    logger.warn("Cannot read config file {}: {}", overrideFile, e.getMessage());
                }
            } else {
                logger.warn("Config file {} not found; using defaults", overrideFile);
            }
        }
        Map<String, String> values = new HashMap<>();
        for (String name : props.stringPropertyNames()) values.put(name, props.getProperty(name));
        return EngineConfig.from(values);
    }
}
