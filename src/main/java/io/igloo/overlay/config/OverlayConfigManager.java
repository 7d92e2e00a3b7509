package io.igloo.overlay.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads and stores {@link OverlayConfig} as a JSON file. */
public final class OverlayConfigManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(OverlayConfigManager.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private final Path configPath;

    private OverlayConfig cached;

    public OverlayConfigManager(Path configPath) {
        this.configPath = Objects.requireNonNull(configPath, "configPath");
    }

    public Path configPath() {
        return configPath;
    }

    public synchronized OverlayConfig load() {
        OverlayConfig config;

        if (Files.exists(configPath)) {
            config = readFromDisk();
        } else {
            config = OverlayConfig.defaults();
        }

        config.sanitize();
        writeToDisk(config);
        cached = config;
        return config;
    }

    public synchronized OverlayConfig getOrLoad() {
        return cached == null ? load() : cached;
    }

    public synchronized void save(OverlayConfig config) {
        config.sanitize();
        writeToDisk(config);
        cached = config;
    }

    private OverlayConfig readFromDisk() {
        try (Reader reader = Files.newBufferedReader(configPath)) {
            OverlayConfig config = gson.fromJson(reader, OverlayConfig.class);
            return config == null ? OverlayConfig.defaults() : config;
        } catch (IOException | JsonParseException ex) {
            LOGGER.warn("Failed to read overlay config from {}, using defaults", configPath, ex);
            return OverlayConfig.defaults();
        }
    }

    private void writeToDisk(OverlayConfig config) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (Writer writer = Files.newBufferedWriter(configPath)) {
                gson.toJson(config, writer);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to write overlay config to {}", configPath, ex);
        }
    }
}
