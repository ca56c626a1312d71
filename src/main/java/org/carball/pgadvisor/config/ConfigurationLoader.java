package org.carball.pgadvisor.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public AdvisorConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");
        return finish(AdvisorConfig.builder(), null, args);
    }

    /**
     * Loads configuration from a specific profile.
     */
    public AdvisorConfig loadProfile(String profileName) {
        try {
            AdvisorConfig config = AdvisorProfile.fromName(profileName).buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Full hierarchy: CLI args > env vars > YAML file > profile > defaults. Both the profile name
     * and the file are optional; a profile named in the file is used when none is given.
     */
    public AdvisorConfig loadConfiguration(String profileName, Path settingsFile, String[] args) throws IOException {
        AdvisorSettings settings = settingsFile != null ? readSettings(settingsFile) : null;

        String profile = profileName != null ? profileName : settings != null ? settings.getProfile() : null;
        AdvisorConfig.AdvisorConfigBuilder builder = profile != null
                ? loadProfile(profile).toBuilder()
                : AdvisorConfig.builder();

        return finish(builder, settings, args);
    }

    public AdvisorSettings readSettings(Path settingsFile) throws IOException {
        if (!Files.exists(settingsFile)) {
            throw new IOException("Advisor settings file not found: " + settingsFile);
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        AdvisorSettings settings = yamlMapper.readValue(settingsFile.toFile(), AdvisorSettings.class);
        log.info("Loaded advisor settings from {}", settingsFile);
        return settings != null ? settings : new AdvisorSettings();
    }

    private AdvisorConfig finish(AdvisorConfig.AdvisorConfigBuilder builder, AdvisorSettings settings, String[] args) {
        if (settings != null) {
            settings.applyTo(builder);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        AdvisorConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(AdvisorConfig.AdvisorConfigBuilder builder) {
        try {
            if (environment.containsKey("PGADVISOR_SIMULATION_TIMEOUT_MS")) {
                builder.simulationTimeoutMs(Long.parseLong(environment.get("PGADVISOR_SIMULATION_TIMEOUT_MS")));
            }
            if (environment.containsKey("PGADVISOR_MINIMUM_GAIN_PERCENT")) {
                builder.minimumGainPercent(Double.parseDouble(environment.get("PGADVISOR_MINIMUM_GAIN_PERCENT")));
            }
            if (environment.containsKey("PGADVISOR_MAX_INDEX_COLUMNS")) {
                builder.maxIndexColumns(Integer.parseInt(environment.get("PGADVISOR_MAX_INDEX_COLUMNS")));
            }
            if (environment.containsKey("PGADVISOR_MINIMUM_EXECUTION_COUNT")) {
                builder.minimumExecutionCount(Long.parseLong(environment.get("PGADVISOR_MINIMUM_EXECUTION_COUNT")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value in PGADVISOR_* environment: {}", e.getMessage());
        }
        if (environment.containsKey("PGADVISOR_SELECTIVITY_POLICY")) {
            builder.selectivityPolicy(SelectivityPolicy.fromName(environment.get("PGADVISOR_SELECTIVITY_POLICY")));
        }
    }

    private void applyCLIArguments(AdvisorConfig.AdvisorConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--advisor.timeout-ms":
                        builder.simulationTimeoutMs(Long.parseLong(value));
                        break;
                    case "--advisor.min-gain":
                        builder.minimumGainPercent(Double.parseDouble(value));
                        break;
                    case "--advisor.max-columns":
                        builder.maxIndexColumns(Integer.parseInt(value));
                        break;
                    case "--advisor.min-executions":
                        builder.minimumExecutionCount(Long.parseLong(value));
                        break;
                    case "--advisor.selectivity":
                        builder.selectivityPolicy(SelectivityPolicy.fromName(value));
                        break;
                    case "--advisor.single-column":
                        builder.includeSingleColumnCandidates(Boolean.parseBoolean(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for advisor configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Advisor Configuration Options:

            CLI Arguments:
              --advisor.timeout-ms <ms>        Per-candidate simulation timeout
              --advisor.min-gain <percent>     Minimum planner cost gain to accept an index
              --advisor.max-columns <num>      Maximum columns in a proposed index
              --advisor.min-executions <num>   Ignore qual groups executed fewer times
              --advisor.selectivity <policy>   distinct-values | filter-ratio
              --advisor.single-column <bool>   Also propose single-column indexes

            Environment Variables:
              PGADVISOR_SIMULATION_TIMEOUT_MS  Same as --advisor.timeout-ms
              PGADVISOR_MINIMUM_GAIN_PERCENT   Same as --advisor.min-gain
              PGADVISOR_MAX_INDEX_COLUMNS      Same as --advisor.max-columns
              PGADVISOR_MINIMUM_EXECUTION_COUNT Same as --advisor.min-executions
              PGADVISOR_SELECTIVITY_POLICY     Same as --advisor.selectivity

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML settings file (--config)
              4. Profile (--profile) or built-in defaults
            """;
    }
}
