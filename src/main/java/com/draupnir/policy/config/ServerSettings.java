package com.draupnir.policy.config;

import lombok.Data;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Process-level settings read from the environment
 */
@Data
public class ServerSettings {

    public static final String DATA_DIR_ENV = "STATIC_MCP_DATA_DIR";
    public static final String EXPOSE_RESOURCES_ENV = "DRAUPNIR_EXPOSE_RESOURCES";
    public static final String RULES_FILE_ENV = "DRAUPNIR_RULES_FILE";
    public static final String DEFAULT_DATA_DIR = "./data";

    /**
     * Root of the policy corpus
     */
    private Path dataDir = Paths.get(DEFAULT_DATA_DIR).toAbsolutePath().normalize();

    /**
     * Publish data files as file:// resources.
     * Read once when the service starts; decides which resource catalog is used.
     */
    private boolean exposeResources = true;

    /**
     * Optional policy-rules.yaml location; null means the default lookup
     */
    private String rulesFile;

    private static ServerSettings instance;

    public static synchronized ServerSettings getInstance() {
        if (instance == null) {
            instance = new ServerSettings();

            String dataDir = System.getenv(DATA_DIR_ENV);
            if (dataDir != null && !dataDir.isBlank()) {
                instance.dataDir = Paths.get(dataDir).toAbsolutePath().normalize();
            }

            String expose = System.getenv(EXPOSE_RESOURCES_ENV);
            if (expose != null) {
                instance.exposeResources = Boolean.parseBoolean(expose);
            }

            instance.rulesFile = System.getenv(RULES_FILE_ENV);
        }
        return instance;
    }

    /**
     * Reset to defaults (useful for testing)
     */
    public static synchronized void reset() {
        instance = null;
    }
}
