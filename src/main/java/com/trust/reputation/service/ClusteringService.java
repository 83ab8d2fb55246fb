package com.trust.reputation.service;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.config.MetricsConfig;
import com.trust.reputation.config.ReputationProperties;
import com.trust.reputation.engine.clustering.ClusteringEngine;
import com.trust.reputation.engine.graph.InputValidationException;
import com.trust.reputation.model.Account;
import com.trust.reputation.model.AccountPair;
import com.trust.reputation.model.Cluster;
import com.trust.reputation.model.ParameterSweep;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

/**
 * Runs clustering, pairwise similarity and threshold sweeps. Every call builds its own
 * ClusteringEngine; the service itself holds no run state.
 */
@Service
public class ClusteringService {

    private static final Logger log = LoggerFactory.getLogger(ClusteringService.class);

    private final ReputationProperties properties;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public ClusteringService(ReputationProperties properties, MetricsConfig metricsConfig, Tracer tracer) {
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    @Observed(name = "clustering.find", contextualName = "find-clusters")
    public List<Cluster> findClusters(List<Account> accounts, ClusteringConfig override) {
        ClusteringConfig config = resolve(override);
        List<Cluster> clusters = traced("clustering.run", config, accounts,
                engine -> engine.findClusters(accounts));

        int highRisk = (int) clusters.stream()
                .filter(c -> c.getRiskScore() >= config.getHighRiskThreshold())
                .count();
        metricsConfig.recordClusteringRun(config.getMethod().name(), clusters.size(), highRisk);
        if (highRisk > 0) {
            log.info("{} of {} clusters at or above risk {}", highRisk, clusters.size(), config.getHighRiskThreshold());
        }
        return clusters;
    }

    @Observed(name = "clustering.similarity", contextualName = "similar-pairs")
    public List<AccountPair> similarPairs(List<Account> accounts, ClusteringConfig override) {
        ClusteringConfig config = resolve(override);
        return traced("clustering.similarity", config, accounts, engine -> engine.similarPairs(accounts));
    }

    /**
     * Offline threshold sweep. Null range bounds fall back to the configured tuning defaults.
     */
    @Observed(name = "clustering.tune", contextualName = "tune-clustering")
    public ParameterSweep tune(List<Account> accounts, ClusteringConfig override,
                               Double min, Double max, Double step) {
        ClusteringConfig config = resolve(override);
        ReputationProperties.Tuning tuning = properties.getTuning();
        double lo = min != null ? min : tuning.getMinSimilarity();
        double hi = max != null ? max : tuning.getMaxSimilarity();
        double inc = step != null ? step : tuning.getStep();

        ParameterSweep sweep = traced("clustering.tune", config, accounts,
                engine -> engine.findOptimalParameters(accounts, lo, hi, inc));
        metricsConfig.recordTuningRun(sweep.getMetrics().size());
        return sweep;
    }

    private ClusteringConfig resolve(ClusteringConfig override) {
        return override != null ? override : properties.getClustering();
    }

    private <T> T traced(String name, ClusteringConfig config, List<Account> accounts,
                         Function<ClusteringEngine, T> work) {
        Span span = tracer.nextSpan()
                .name(name)
                .tag("clustering.method", String.valueOf(config.getMethod()))
                .tag("clustering.accounts", String.valueOf(accounts != null ? accounts.size() : 0))
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return work.apply(new ClusteringEngine(config));
        } catch (InputValidationException e) {
            span.error(e);
            metricsConfig.recordValidationFailure("clustering");
            log.warn("Rejected clustering request: {} (subject={}, field={})",
                    e.getMessage(), e.getSubject(), e.getField());
            throw e;
        } finally {
            span.end();
        }
    }
}
