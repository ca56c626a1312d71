package org.carball.pgadvisor.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * YAML form of the advisor configuration. Absent keys leave the underlying value alone.
 */
@Data
public class AdvisorSettings {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("simulation_timeout_ms")
    private Long simulationTimeoutMs;

    @JsonProperty("minimum_gain_percent")
    private Double minimumGainPercent;

    @JsonProperty("max_index_columns")
    private Integer maxIndexColumns;

    @JsonProperty("minimum_execution_count")
    private Long minimumExecutionCount;

    @JsonProperty("include_single_column_candidates")
    private Boolean includeSingleColumnCandidates;

    @JsonProperty("selectivity_policy")
    private String selectivityPolicy;

    public void applyTo(AdvisorConfig.AdvisorConfigBuilder builder) {
        if (simulationTimeoutMs != null) {
            builder.simulationTimeoutMs(simulationTimeoutMs);
        }
        if (minimumGainPercent != null) {
            builder.minimumGainPercent(minimumGainPercent);
        }
        if (maxIndexColumns != null) {
            builder.maxIndexColumns(maxIndexColumns);
        }
        if (minimumExecutionCount != null) {
            builder.minimumExecutionCount(minimumExecutionCount);
        }
        if (includeSingleColumnCandidates != null) {
            builder.includeSingleColumnCandidates(includeSingleColumnCandidates);
        }
        if (selectivityPolicy != null) {
            builder.selectivityPolicy(SelectivityPolicy.fromName(selectivityPolicy));
        }
    }
}
