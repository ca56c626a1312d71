package org.carball.pgadvisor.config;

import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
public enum AdvisorProfile {

    CONSERVATIVE("conservative", "Only recommend indexes with a clear gain on frequent quals",
            10.0, 2, 100, false),

    BALANCED("balanced", "Default settings for most workloads",
            1.0, 3, 1, true),

    AGGRESSIVE("aggressive", "Surface every index the planner would use",
            0.0, 4, 1, true);

    private final String name;
    private final String description;
    private final double minimumGainPercent;
    private final int maxIndexColumns;
    private final long minimumExecutionCount;
    private final boolean includeSingleColumnCandidates;

    AdvisorProfile(String name, String description, double minimumGainPercent, int maxIndexColumns,
                   long minimumExecutionCount, boolean includeSingleColumnCandidates) {
        this.name = name;
        this.description = description;
        this.minimumGainPercent = minimumGainPercent;
        this.maxIndexColumns = maxIndexColumns;
        this.minimumExecutionCount = minimumExecutionCount;
        this.includeSingleColumnCandidates = includeSingleColumnCandidates;
    }

    public AdvisorConfig buildConfig() {
        return AdvisorConfig.builder()
                .profileName(name)
                .minimumGainPercent(minimumGainPercent)
                .maxIndexColumns(maxIndexColumns)
                .minimumExecutionCount(minimumExecutionCount)
                .includeSingleColumnCandidates(includeSingleColumnCandidates)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static AdvisorProfile fromName(String name) {
        for (AdvisorProfile profile : values()) {
            if (profile.name.equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown advisor profile: " + name + ". Available profiles: "
                + Arrays.stream(values()).map(AdvisorProfile::getName).collect(Collectors.joining(", ")));
    }
}
