package org.carball.pgadvisor.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AdvisorProfileTest {

    @Test
    void shouldFindProfileIgnoringCase() {
        assertThat(AdvisorProfile.fromName("Balanced")).isEqualTo(AdvisorProfile.BALANCED);
    }

    @Test
    void shouldKeepDefaultTimeoutAndPolicyInProfiles() {
        for (AdvisorProfile profile : AdvisorProfile.values()) {
            AdvisorConfig config = profile.buildConfig();
            assertThat(config.getProfileName()).isEqualTo(profile.getName());
            assertThat(config.getSimulationTimeoutMs()).isEqualTo(5000);
            assertThat(config.getSelectivityPolicy()).isEqualTo(SelectivityPolicy.DISTINCT_VALUES);
        }
    }

    @Test
    void shouldGetStricterFromAggressiveToConservative() {
        AdvisorConfig aggressive = AdvisorProfile.AGGRESSIVE.buildConfig();
        AdvisorConfig conservative = AdvisorProfile.CONSERVATIVE.buildConfig();

        assertThat(conservative.getMinimumGainPercent()).isGreaterThan(aggressive.getMinimumGainPercent());
        assertThat(conservative.getMaxIndexColumns()).isLessThan(aggressive.getMaxIndexColumns());
        assertThat(conservative.getMinimumExecutionCount()).isGreaterThan(aggressive.getMinimumExecutionCount());
    }

    @Test
    void shouldParseSelectivityPolicyNames() {
        assertThat(SelectivityPolicy.fromName("distinct-values")).isEqualTo(SelectivityPolicy.DISTINCT_VALUES);
        assertThat(SelectivityPolicy.fromName("FILTER_RATIO")).isEqualTo(SelectivityPolicy.FILTER_RATIO);
        assertThatThrownBy(() -> SelectivityPolicy.fromName("random"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
