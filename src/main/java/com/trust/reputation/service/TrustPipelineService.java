package com.trust.reputation.service;

import com.trust.reputation.model.Account;
import com.trust.reputation.model.Cluster;
import com.trust.reputation.model.PipelineRequest;
import com.trust.reputation.model.PipelineResult;
import com.trust.reputation.model.ReputationRequest;
import com.trust.reputation.model.ReputationResult;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Community-based Sybil detection: score the graph, turn the scored nodes into
 * accounts, then cluster them.
 */
@Service
public class TrustPipelineService {

    private static final Logger log = LoggerFactory.getLogger(TrustPipelineService.class);

    private final ReputationService reputationService;
    private final ClusteringService clusteringService;
    private final AccountAssembler accountAssembler;

    public TrustPipelineService(ReputationService reputationService,
                                ClusteringService clusteringService,
                                AccountAssembler accountAssembler) {
        this.reputationService = reputationService;
        this.clusteringService = clusteringService;
        this.accountAssembler = accountAssembler;
    }

    @Observed(name = "pipeline.analyze", contextualName = "analyze-graph")
    public PipelineResult analyze(PipelineRequest request) {
        ReputationResult reputation = reputationService.compute(ReputationRequest.builder()
                .graph(request.getGraph())
                .config(request.getScoring())
                .build());

        List<Account> accounts = accountAssembler.toAccounts(request.getGraph(), reputation,
                request.getAccountAttributes());
        List<Cluster> clusters = clusteringService.findClusters(accounts, request.getClustering());

        log.info("Pipeline produced {} scores and {} clusters", reputation.getScores().size(), clusters.size());
        return PipelineResult.builder()
                .reputation(reputation)
                .clusters(clusters)
                .build();
    }
}
