package org.accesstwin.consult.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists the chosen backend as JSON, by default at {@code ~/.accesstwin/ai_settings.json}.
 * Failures are logged and never thrown: a missing or unreadable file loads as empty.
 */
public class SettingsStore {

    private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);

    private final Path settingsFile;
    private final ObjectMapper objectMapper;

    public SettingsStore() {
        this(ConsultPaths.settingsFile(), new ObjectMapper());
    }

    public SettingsStore(Path settingsFile, ObjectMapper objectMapper) {
        this.settingsFile = settingsFile;
        this.objectMapper = objectMapper;
    }

    public Path getSettingsFile() {
        return settingsFile;
    }

    public Optional<GatewayConfig> load() {
        if (!Files.isRegularFile(settingsFile)) {
            return Optional.empty();
        }
        try {
            GatewayConfig config = objectMapper.readValue(settingsFile.toFile(), GatewayConfig.class);
            if (config == null || config.getFamily() == null) {
                logger.warn("Ignoring AI settings without a provider family: {}", settingsFile);
                return Optional.empty();
            }
            logger.debug("Loaded AI settings for {}", config.getFamily());
            return Optional.of(config);
        } catch (IOException e) {
            logger.warn("Failed to read AI settings from {}: {}", settingsFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the config. Returns false if it could not be written.
     */
    public boolean save(GatewayConfig config) {
        try {
            Path parent = settingsFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .writeValue(settingsFile.toFile(), config);
            logger.info("Saved AI settings for {} to {}", config.getFamily(), settingsFile);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to save AI settings to {}: {}", settingsFile, e.getMessage());
            return false;
        }
    }

    public boolean clear() {
        try {
            boolean deleted = Files.deleteIfExists(settingsFile);
            if (deleted) {
                logger.info("Cleared AI settings at {}", settingsFile);
            }
            return deleted;
        } catch (IOException e) {
            logger.warn("Failed to clear AI settings at {}: {}", settingsFile, e.getMessage());
            return false;
        }
    }
}
