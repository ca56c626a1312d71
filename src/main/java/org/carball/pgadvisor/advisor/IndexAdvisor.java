package org.carball.pgadvisor.advisor;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.analyzer.QualUsageAggregator;
import org.carball.pgadvisor.config.AdvisorConfig;
import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.model.index.AdvisorRun;
import org.carball.pgadvisor.model.index.AdvisorScope;
import org.carball.pgadvisor.model.index.IndexCandidate;
import org.carball.pgadvisor.model.index.Recommendation;
import org.carball.pgadvisor.model.index.SimulationResult;
import org.carball.pgadvisor.model.index.SimulationStatus;
import org.carball.pgadvisor.model.qual.QualAggregation;
import org.carball.pgadvisor.model.qual.QualGroup;
import org.carball.pgadvisor.model.qual.QualUsageRow;
import org.carball.pgadvisor.parser.StoreUnavailableException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Workload-wide index advisor: turns qual usage into ranked index recommendations.
 * <p>
 * Each run aggregates the qual rows of its scope, proposes candidates, drops those whose access
 * method the server lacks, then simulates the rest one by one. A simulation that errors or exceeds
 * the configured timeout only marks its candidate {@link SimulationStatus#SIMULATION_FAILED}; the run
 * goes on. Runs share no state, so one advisor can serve concurrent callers.
 */
@Slf4j
public class IndexAdvisor implements AutoCloseable {

    static final Comparator<Recommendation> RANKING = Comparator
            .comparingDouble(Recommendation::benefitScore).reversed()
            .thenComparingInt(recommendation -> recommendation.candidate().columns().size())
            .thenComparing(recommendation -> recommendation.candidate().tableIdentifier())
            .thenComparing(recommendation -> recommendation.candidate().database())
            .thenComparing(recommendation -> String.join(",", recommendation.candidate().columns()))
            .thenComparing(recommendation -> recommendation.candidate().accessMethod());

    private final AdvisorConfig config;
    private final HypotheticalIndexSimulator simulator;
    private final AccessMethodCapabilities capabilities;
    private final QualUsageAggregator aggregator;
    private final CandidateProposer proposer;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public IndexAdvisor(AdvisorConfig config, HypotheticalIndexSimulator simulator,
                        AccessMethodCapabilities capabilities) {
        this(config, simulator, capabilities, Executors.newCachedThreadPool(new SimulationThreadFactory()), true);
    }

    public IndexAdvisor(AdvisorConfig config, HypotheticalIndexSimulator simulator,
                        AccessMethodCapabilities capabilities, ExecutorService executor) {
        this(config, simulator, capabilities, executor, false);
    }

    private IndexAdvisor(AdvisorConfig config, HypotheticalIndexSimulator simulator,
                         AccessMethodCapabilities capabilities, ExecutorService executor, boolean ownsExecutor) {
        this.config = config;
        this.simulator = simulator;
        this.capabilities = capabilities;
        this.aggregator = new QualUsageAggregator();
        this.proposer = new CandidateProposer(config);
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        log.debug("Initialized IndexAdvisor: {}", config.getConfigurationSummary());
    }

    /**
     * Ranked recommendations for the scope; empty when nothing survives simulation.
     *
     * @throws StoreUnavailableException if the server's access methods cannot be read
     * @throws CancellationException if the calling thread is interrupted during the run
     */
    public List<Recommendation> advise(AdvisorScope scope, List<QualUsageRow> qualRows) throws StoreUnavailableException {
        return run(scope, qualRows).recommendations();
    }

    public AdvisorRun run(AdvisorScope scope, List<QualUsageRow> qualRows) throws StoreUnavailableException {
        log.info("Starting index advisor run for {} with {} qual rows", scope, qualRows.size());
        QualAggregation aggregation = aggregator.aggregate(scope, qualRows);
        if (aggregation.groups().isEmpty()) {
            log.info("No optimizable quals for {}", scope);
            return new AdvisorRun(scope, List.of(), List.of(), aggregation.nonOptimizable(),
                    aggregation.diagnostics(), 0);
        }
        Set<AccessMethod> supported = capabilities.supportedAccessMethods(scope.server());
        return run(scope, aggregation, supported);
    }

    /**
     * Runs the advisor over already aggregated quals against an explicit set of installed access methods.
     */
    public AdvisorRun run(AdvisorScope scope, QualAggregation aggregation, Set<AccessMethod> supported) {
        List<IndexCandidate> proposed = proposer.propose(aggregation.groups());

        List<IndexCandidate> feasible = new ArrayList<>();
        int dropped = 0;
        for (IndexCandidate candidate : proposed) {
            if (supported.contains(candidate.accessMethod())) {
                feasible.add(candidate);
            } else {
                dropped++;
                log.debug("Dropping {}: {} not installed on {}", candidate, candidate.accessMethod(), scope.server());
            }
        }

        List<IndexCandidate> evaluated = new ArrayList<>(feasible.size());
        for (IndexCandidate candidate : feasible) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Index advisor run for " + scope + " cancelled");
            }
            evaluated.add(evaluate(candidate));
        }

        List<Recommendation> recommendations = rank(evaluated);
        AdvisorRun run = new AdvisorRun(scope, recommendations, List.copyOf(evaluated),
                aggregation.nonOptimizable(), aggregation.diagnostics(), dropped);
        log.info("Index advisor run complete. {}", run.getSummary());
        return run;
    }

    /**
     * Ranks groups directly, without a scope; used when quals were aggregated elsewhere.
     */
    public List<Recommendation> advise(List<QualGroup> groups, Set<AccessMethod> supported) {
        if (groups.isEmpty()) {
            return List.of();
        }
        AdvisorScope scope = AdvisorScope.workload(groups.get(0).server());
        return run(scope, new QualAggregation(groups, List.of(), List.of()), supported).recommendations();
    }

    IndexCandidate evaluate(IndexCandidate candidate) {
        Future<SimulationResult> future;
        try {
            future = executor.submit(() -> simulator.simulate(candidate));
        } catch (RejectedExecutionException e) {
            log.warn("Cannot schedule simulation of {}: {}", candidate, e.getMessage());
            return candidate.simulationFailed("simulation executor rejected the task");
        }

        try {
            SimulationResult result = future.get(config.getSimulationTimeoutMs(), TimeUnit.MILLISECONDS);
            if (result == null) {
                log.warn("Simulation of {} returned no result", candidate);
                return candidate.simulationFailed("simulator returned no result");
            }
            return classify(candidate, result);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Simulation of {} timed out after {} ms", candidate, config.getSimulationTimeoutMs());
            return candidate.simulationFailed("timed out after " + config.getSimulationTimeoutMs() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Simulation of {} failed: {}", candidate, cause.getMessage());
            log.debug("Simulation failure details", cause);
            return candidate.simulationFailed(String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Index advisor run interrupted while simulating " + candidate);
        }
    }

    IndexCandidate classify(IndexCandidate candidate, SimulationResult result) {
        if (!result.indexUsed()) {
            log.debug("Rejected {}: planner did not use {}", candidate, result.indexName());
            return candidate.rejected(result);
        }
        if (result.costReduction() <= 0 || result.gainPercent() < config.getMinimumGainPercent()) {
            log.debug("Rejected {}: gain {}% below {}%", candidate, result.gainPercent(), config.getMinimumGainPercent());
            return candidate.rejected(result);
        }
        double benefit = result.costReduction() * candidate.totalExecutionCount();
        log.debug("Accepted {}: gain {}%, benefit {}", candidate, result.gainPercent(), benefit);
        return candidate.accepted(result, benefit);
    }

    static List<Recommendation> rank(List<IndexCandidate> evaluated) {
        return evaluated.stream()
                .filter(candidate -> candidate.status() == SimulationStatus.ACCEPTED)
                .map(Recommendation::of)
                .sorted(RANKING)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static class SimulationThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "hypo-simulation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
