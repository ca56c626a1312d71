package org.carball.pgadvisor.config;

/**
 * Statistic used to put the most selective predicate first in a multi-column candidate.
 */
public enum SelectivityPolicy {
    /** Higher estimated distinct count first (pg_statistic n_distinct). */
    DISTINCT_VALUES,
    /** Higher share of rows filtered out per execution first (pg_qualstats nbfiltered / count). */
    FILTER_RATIO;

    public static SelectivityPolicy fromName(String name) {
        for (SelectivityPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(name.replace('-', '_'))) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown selectivity policy: " + name);
    }
}
