package org.accesstwin.consult.gateway.config;

import org.accesstwin.consult.common.ConsultConstants;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * File locations, overridable with the {@code accesstwin.home} and
 * {@code accesstwin.models.dir} system properties.
 */
public final class ConsultPaths {

    private ConsultPaths() {
    }

    public static Path homeDir() {
        String home = System.getProperty(ConsultConstants.HOME_DIR_PROPERTY);
        if (home != null && !home.isBlank()) {
            return Paths.get(home);
        }
        return Paths.get(System.getProperty("user.home"), ".accesstwin");
    }

    public static Path modelsDir() {
        String models = System.getProperty(ConsultConstants.MODELS_DIR_PROPERTY);
        if (models != null && !models.isBlank()) {
            return Paths.get(models);
        }
        return homeDir().resolve("models");
    }

    public static Path settingsFile() {
        return homeDir().resolve(ConsultConstants.SETTINGS_FILE_NAME);
    }
}
