package org.carball.pgadvisor.model.index;

import org.carball.pgadvisor.model.qual.QualGroup;

import java.util.List;

public record Recommendation(
        IndexCandidate candidate,
        double benefitScore,
        List<QualGroup> supportingQualGroups
) {

    public static Recommendation of(IndexCandidate candidate) {
        if (candidate.status() != SimulationStatus.ACCEPTED || candidate.estimatedBenefit() == null) {
            throw new IllegalArgumentException("Only accepted candidates can be recommended: " + candidate);
        }
        return new Recommendation(candidate, candidate.estimatedBenefit(), candidate.supportingGroups());
    }

    public String ddl() {
        return candidate.ddl();
    }
}
