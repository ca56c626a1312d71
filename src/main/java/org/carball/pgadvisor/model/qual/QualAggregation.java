package org.carball.pgadvisor.model.qual;

import java.util.List;

public record QualAggregation(
        List<QualGroup> groups,
        List<NonOptimizableQual> nonOptimizable,
        List<String> diagnostics
) {}
