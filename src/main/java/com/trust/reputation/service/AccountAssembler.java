package com.trust.reputation.service;

import com.trust.reputation.model.Account;
import com.trust.reputation.model.AccountAttributes;
import com.trust.reputation.model.Connection;
import com.trust.reputation.model.Contribution;
import com.trust.reputation.model.GraphEdge;
import com.trust.reputation.model.GraphNode;
import com.trust.reputation.model.GraphSnapshot;
import com.trust.reputation.model.NodeAttributes;
import com.trust.reputation.model.ReputationResult;
import com.trust.reputation.model.ReputationScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a scored graph with raw profile attributes into clustering input.
 * Out-edges become connections, edge timestamps and the node's last activity become
 * contributions, and the scorer's finalScore and Sybil probability are carried over.
 */
@Component
public class AccountAssembler {

    static final String EDGE_CONTRIBUTION = "edge";
    static final String ACTIVITY_CONTRIBUTION = "activity";

    public List<Account> toAccounts(GraphSnapshot graph, ReputationResult result,
                                    Map<String, AccountAttributes> rawAttributes) {
        Map<String, List<Connection>> connections = new HashMap<>();
        Map<String, List<Contribution>> contributions = new HashMap<>();
        for (GraphEdge edge : graph.edgesOrEmpty()) {
            connections.computeIfAbsent(edge.getSource(), k -> new ArrayList<>())
                    .add(Connection.builder().target(edge.getTarget()).weight(edge.getWeight()).build());
            contributions.computeIfAbsent(edge.getSource(), k -> new ArrayList<>())
                    .add(Contribution.builder()
                            .timestamp(edge.getTimestamp())
                            .type(EDGE_CONTRIBUTION + ":" + edge.getEdgeType())
                            .build());
        }

        Map<String, Account> accounts = new LinkedHashMap<>();
        for (GraphNode node : graph.nodesOrEmpty()) {
            NodeAttributes nodeAttrs = node.attributesOrEmpty();
            List<Contribution> nodeContributions = new ArrayList<>(
                    contributions.getOrDefault(node.getId(), new ArrayList<>()));
            if (nodeAttrs.getActivityRecency() != null) {
                nodeContributions.add(Contribution.builder()
                        .timestamp(nodeAttrs.getActivityRecency())
                        .type(ACTIVITY_CONTRIBUTION)
                        .build());
            }

            ReputationScore score = result.getScores() != null ? result.getScores().get(node.getId()) : null;
            Double sybil = result.getSybilProbabilities() != null
                    ? result.getSybilProbabilities().get(node.getId())
                    : null;

            accounts.put(node.getId(), Account.builder()
                    .accountId(node.getId())
                    .reputation(score != null ? score.getFinalScore() : null)
                    .sybilProbability(sybil)
                    .connections(connections.getOrDefault(node.getId(), new ArrayList<>()))
                    .contributions(nodeContributions)
                    .attributes(mergeAttributes(nodeAttrs,
                            rawAttributes != null ? rawAttributes.get(node.getId()) : null))
                    .build());
        }
        return new ArrayList<>(accounts.values());
    }

    // Raw profile values win; stake and payment history fall back to the node's
    private static AccountAttributes mergeAttributes(NodeAttributes node, AccountAttributes raw) {
        AccountAttributes.AccountAttributesBuilder builder = AccountAttributes.builder();
        if (raw != null) {
            builder.emailDomain(raw.getEmailDomain())
                    .registrationDate(raw.getRegistrationDate())
                    .activityLevel(raw.getActivityLevel())
                    .extensions(raw.getExtensions());
        }
        builder.stake(raw != null && raw.getStake() != null ? raw.getStake() : node.getStake());
        builder.paymentHistory(raw != null && raw.getPaymentHistory() != null
                ? raw.getPaymentHistory()
                : node.getPaymentHistory());
        return builder.build();
    }
}
