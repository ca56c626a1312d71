package org.carball.pgadvisor.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AdvisorConfig {

    // Simulation
    @Builder.Default
    private long simulationTimeoutMs = 5000;

    @Builder.Default
    private double minimumGainPercent = 1.0;

    // Candidate proposal
    @Builder.Default
    private int maxIndexColumns = 3;

    @Builder.Default
    private long minimumExecutionCount = 1;

    @Builder.Default
    private boolean includeSingleColumnCandidates = true;

    @Builder.Default
    private SelectivityPolicy selectivityPolicy = SelectivityPolicy.DISTINCT_VALUES;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    public static AdvisorConfig defaults() {
        return AdvisorConfig.builder().build();
    }

    public Duration getSimulationTimeout() {
        return Duration.ofMillis(simulationTimeoutMs);
    }

    /**
     * Logs warnings for values that make the advisor behave oddly. Nothing is rejected.
     */
    public void validate() {
        if (simulationTimeoutMs <= 0) {
            log.warn("Simulation timeout ({} ms) should be positive, every candidate will fail simulation",
                    simulationTimeoutMs);
        }
        if (maxIndexColumns < 1) {
            log.warn("Max index columns ({}) should be at least 1, no candidate can be proposed", maxIndexColumns);
        }
        if (minimumGainPercent < 0 || minimumGainPercent > 100) {
            log.warn("Minimum gain percent ({}) should be between 0 and 100", minimumGainPercent);
        }
        if (minimumExecutionCount < 0) {
            log.warn("Minimum execution count ({}) should not be negative", minimumExecutionCount);
        }

        log.debug("Using advisor config - timeout: {} ms, min gain: {}%, max columns: {}, profile: {}",
                simulationTimeoutMs, minimumGainPercent, maxIndexColumns, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Timeout: %d ms | Min gain: %.1f%% | Max columns: %d | Min executions: %d | Selectivity: %s",
                profileName, simulationTimeoutMs, minimumGainPercent, maxIndexColumns,
                minimumExecutionCount, selectivityPolicy);
    }
}
