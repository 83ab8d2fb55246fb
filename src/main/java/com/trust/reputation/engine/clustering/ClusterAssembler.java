package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.model.Account;
import com.trust.reputation.model.Cluster;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes density, cohesion, risk score and pattern tags for an accepted group.
 * <p>
 * The risk score is a heuristic ranking signal in [0, 1]. It does not establish that
 * the accounts are coordinated.
 */
public class ClusterAssembler {

    public static final String SHARED_EMAIL_DOMAIN = "shared_email_domain";
    public static final String LOW_REPUTATION = "low_reputation";
    public static final String LARGE_CLUSTER = "large_cluster";
    public static final String HIGH_CONNECTIVITY = "high_connectivity";
    public static final String TIGHTLY_KNIT = "tightly_knit";
    public static final String SYBIL_SIGNALS = "sybil_signals";

    private static final double DENSE = 0.7;
    private static final double COHESIVE = 0.5;
    private static final double INTERNAL_CONNECTIONS_PER_MEMBER = 2.0;
    private static final double SYBIL_MEAN = 0.5;

    private final ClusteringConfig config;

    public ClusterAssembler(ClusteringConfig config) {
        this.config = config;
    }

    public Cluster assemble(ClusteringContext context, int[] group) {
        int size = group.length;
        double similarityTotal = 0.0;
        int connectedPairs = 0;
        int internalConnections = 0;
        for (int a = 0; a < size; a++) {
            for (int b = a + 1; b < size; b++) {
                similarityTotal += context.similarity(group[a], group[b]);
                if (context.connected(group[a], group[b])) {
                    connectedPairs++;
                }
                if (context.connects(group[a], group[b])) internalConnections++;
                if (context.connects(group[b], group[a])) internalConnections++;
            }
        }
        double pairs = size * (size - 1) / 2.0;
        double density = pairs > 0 ? similarityTotal / pairs : 0.0;
        double cohesion = pairs > 0 ? connectedPairs / pairs : 0.0;

        double reputationTotal = 0.0;
        double sybilTotal = 0.0;
        int sybilCount = 0;
        Set<String> domains = new TreeSet<>();
        int declaringEmail = 0;
        List<String> ids = new ArrayList<>(size);
        for (int index : group) {
            Account account = context.account(index);
            ids.add(account.getAccountId());
            reputationTotal += account.getReputation() != null ? account.getReputation() : 0.0;
            if (account.getSybilProbability() != null) {
                sybilTotal += account.getSybilProbability();
                sybilCount++;
            }
            if (account.getAttributes() != null && account.getAttributes().getEmailDomain() != null
                    && !account.getAttributes().getEmailDomain().isBlank()) {
                declaringEmail++;
                domains.add(account.getAttributes().getEmailDomain().trim().toLowerCase(Locale.ROOT));
            }
        }
        double meanReputation = reputationTotal / size;

        double risk = 0.0;
        List<String> patterns = new ArrayList<>();
        boolean sharedEmail = domains.size() == 1 && declaringEmail >= config.getSharedEmailDomainMinAccounts();
        if (sharedEmail) {
            risk += 0.3;
            patterns.add(SHARED_EMAIL_DOMAIN);
        }
        if (meanReputation < config.getLowReputationThreshold()) {
            risk += 0.2;
            patterns.add(LOW_REPUTATION);
        }
        if (size > config.getLargeClusterSize()) {
            risk += 0.2;
            patterns.add(LARGE_CLUSTER);
        }
        if ((double) internalConnections / size > INTERNAL_CONNECTIONS_PER_MEMBER) {
            patterns.add(HIGH_CONNECTIVITY);
        }
        if (density > DENSE && cohesion > COHESIVE) {
            risk += 0.3;
            patterns.add(TIGHTLY_KNIT);
        }
        if (sybilCount > 0 && sybilTotal / sybilCount >= SYBIL_MEAN) {
            risk += 0.2;
            patterns.add(SYBIL_SIGNALS);
        }

        return Cluster.builder()
                .accounts(ids)
                .size(size)
                .density(density)
                .cohesion(cohesion)
                .riskScore(Math.min(1.0, risk))
                .patterns(patterns)
                .build();
    }
}
