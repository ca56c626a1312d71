package org.carball.pgadvisor.advisor;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.config.AdvisorConfig;
import org.carball.pgadvisor.config.SelectivityPolicy;
import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.model.index.IndexCandidate;
import org.carball.pgadvisor.model.qual.QualGroup;
import org.carball.pgadvisor.model.qual.QualPredicate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Proposes index definitions for qual groups and merges identical proposals.
 * <p>
 * For every access method that can serve at least one predicate of a group, one candidate covers
 * all the predicates that method serves, most selective column first. Methods that cannot index
 * several columns, and the single-column variants when enabled, get one candidate per column.
 */
@Slf4j
public class CandidateProposer {

    private final AdvisorConfig config;

    public CandidateProposer(AdvisorConfig config) {
        this.config = config;
    }

    public List<IndexCandidate> propose(List<QualGroup> groups) {
        Map<IndexCandidate.Key, IndexCandidate> candidates = new LinkedHashMap<>();
        for (QualGroup group : groups) {
            if (group.executionCount() < config.getMinimumExecutionCount()) {
                log.debug("Skipping {}: {} executions below minimum {}", group.signature(),
                        group.executionCount(), config.getMinimumExecutionCount());
                continue;
            }
            for (IndexCandidate candidate : proposeFor(group)) {
                candidates.merge(candidate.key(), candidate,
                        (existing, added) -> existing.withSupportingGroup(group));
            }
        }
        log.debug("Proposed {} distinct candidates from {} qual groups", candidates.size(), groups.size());
        return new ArrayList<>(candidates.values());
    }

    List<IndexCandidate> proposeFor(QualGroup group) {
        List<IndexCandidate> proposals = new ArrayList<>();
        if (config.getMaxIndexColumns() < 1) {
            return proposals;
        }

        List<QualPredicate> bySelectivity = orderBySelectivity(group);
        Set<AccessMethod> methods = EnumSet.noneOf(AccessMethod.class);
        group.predicates().forEach(predicate -> methods.addAll(predicate.accessMethods()));

        for (AccessMethod method : methods) {
            List<String> columns = bySelectivity.stream()
                    .filter(predicate -> predicate.accessMethods().contains(method))
                    .map(QualPredicate::column)
                    .distinct()
                    .collect(Collectors.toList());

            if (columns.size() == 1 || method.isMultiColumn()) {
                List<String> capped = columns.subList(0, Math.min(columns.size(), config.getMaxIndexColumns()));
                proposals.add(IndexCandidate.proposed(group, capped, method));
            }
            if (columns.size() > 1 && (!method.isMultiColumn() || config.isIncludeSingleColumnCandidates())) {
                for (String column : columns) {
                    proposals.add(IndexCandidate.proposed(group, List.of(column), method));
                }
            }
        }
        return proposals;
    }

    /**
     * Most selective first; ties fall back to the other statistic, then to column name.
     */
    List<QualPredicate> orderBySelectivity(QualGroup group) {
        Comparator<QualPredicate> byDistinct = Comparator.comparingDouble(
                predicate -> predicate.estimatedDistinctValues(group.tableLiveRows()));
        Comparator<QualPredicate> byFilterRatio = Comparator.comparingDouble(QualPredicate::filterRatio);

        Comparator<QualPredicate> order = config.getSelectivityPolicy() == SelectivityPolicy.FILTER_RATIO
                ? byFilterRatio.reversed().thenComparing(byDistinct.reversed())
                : byDistinct.reversed().thenComparing(byFilterRatio.reversed());

        return group.predicates().stream()
                .sorted(order.thenComparing(QualPredicate::column))
                .collect(Collectors.toList());
    }
}
