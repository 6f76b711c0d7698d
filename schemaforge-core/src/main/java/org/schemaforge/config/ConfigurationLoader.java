package org.schemaforge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.schemaforge.config.SchemaForgeConfiguration.ProfileConfiguration;
import org.schemaforge.options.SchemaForgeOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = SchemaForgeOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = SchemaForgeOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = SchemaForgeOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads the configuration and applies the active profile.
     * <p>
     * Profile precedence: CLI argument, then {@code SCHEMAFORGE_PROFILE}, then {@code dev}.
     *
     * @param cliProfile profile named on the command line, may be null
     * @return option key to value, every key of {@link SchemaForgeOptions} present
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<SchemaForgeConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    public SchemaForgeSettings loadSettings(String cliProfile) {
        return new SchemaForgeSettings(loadConfiguration(cliProfile));
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Searches schemaforge.yaml from the start directory upwards.
     */
    private Optional<SchemaForgeConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    SchemaForgeConfiguration config = yamlMapper.readValue(configFile.toFile(), SchemaForgeConfiguration.class);
                    log.debug("Loaded configuration from {}", configFile);
                    return Optional.of(config);
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(SchemaForgeConfiguration config, String profile) {
        ProfileConfiguration profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        Map<String, String> configMap = new HashMap<>(createDefaultConfiguration());

        var inference = profileConfig.getInference();
        if (inference != null) {
            putIfSet(configMap, SchemaForgeOptions.Inference.TEMPORAL_MATCH_RATIO_KEY, inference.getTemporalMatchRatio());
            putIfSet(configMap, SchemaForgeOptions.Inference.TEXT_LENGTH_THRESHOLD_KEY, inference.getTextLengthThreshold());
            putIfSet(configMap, SchemaForgeOptions.Inference.STANDARDIZE_NAMES_KEY, inference.getStandardizeNames());
        }
        var keys = profileConfig.getKeys();
        if (keys != null) {
            putIfSet(configMap, SchemaForgeOptions.Keys.MIN_UNIQUENESS_KEY, keys.getMinUniqueness());
            putIfSet(configMap, SchemaForgeOptions.Keys.MAX_COMPOSITE_COLUMNS_KEY, keys.getMaxCompositeColumns());
            putIfSet(configMap, SchemaForgeOptions.Keys.MIN_CONFIDENCE_KEY, keys.getMinConfidence());
        }
        if (profileConfig.getOutput() != null) {
            putIfSet(configMap, SchemaForgeOptions.Output.PLATFORM_KEY, profileConfig.getOutput().getPlatform());
        }
        var incremental = profileConfig.getIncremental();
        if (incremental != null) {
            putIfSet(configMap, SchemaForgeOptions.Incremental.FAR_FUTURE_DATE_KEY, incremental.getFarFutureDate());
            putIfSet(configMap, SchemaForgeOptions.Incremental.STAGING_SUFFIX_KEY, incremental.getStagingSuffix());
        }

        return configMap;
    }

    private static void putIfSet(Map<String, String> configMap, String key, Object value) {
        if (value != null) {
            configMap.put(key, String.valueOf(value));
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            SchemaForgeOptions.Inference.TEMPORAL_MATCH_RATIO_KEY, String.valueOf(SchemaForgeOptions.Inference.TEMPORAL_MATCH_RATIO_DEFAULT),
            SchemaForgeOptions.Inference.TEXT_LENGTH_THRESHOLD_KEY, String.valueOf(SchemaForgeOptions.Inference.TEXT_LENGTH_THRESHOLD_DEFAULT),
            SchemaForgeOptions.Inference.STANDARDIZE_NAMES_KEY, String.valueOf(SchemaForgeOptions.Inference.STANDARDIZE_NAMES_DEFAULT),
            SchemaForgeOptions.Keys.MIN_UNIQUENESS_KEY, String.valueOf(SchemaForgeOptions.Keys.MIN_UNIQUENESS_DEFAULT),
            SchemaForgeOptions.Keys.MAX_COMPOSITE_COLUMNS_KEY, String.valueOf(SchemaForgeOptions.Keys.MAX_COMPOSITE_COLUMNS_DEFAULT),
            SchemaForgeOptions.Keys.MIN_CONFIDENCE_KEY, String.valueOf(SchemaForgeOptions.Keys.MIN_CONFIDENCE_DEFAULT),
            SchemaForgeOptions.Output.PLATFORM_KEY, SchemaForgeOptions.Output.PLATFORM_DEFAULT,
            SchemaForgeOptions.Incremental.FAR_FUTURE_DATE_KEY, SchemaForgeOptions.Incremental.FAR_FUTURE_DATE_DEFAULT,
            SchemaForgeOptions.Incremental.STAGING_SUFFIX_KEY, SchemaForgeOptions.Incremental.STAGING_SUFFIX_DEFAULT
        );
    }
}
