package com.trust.reputation.service;

import com.trust.reputation.model.Account;
import com.trust.reputation.model.AccountAttributes;
import com.trust.reputation.model.Contribution;
import com.trust.reputation.model.GraphNode;
import com.trust.reputation.model.GraphSnapshot;
import com.trust.reputation.model.NodeAttributes;
import com.trust.reputation.model.ReputationResult;
import com.trust.reputation.model.ReputationScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.trust.reputation.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class AccountAssemblerTest {

    private AccountAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new AccountAssembler();
    }

    @Test
    void toAccounts_mapsEdgesScoresAndAttributes() {
        GraphNode a = GraphNode.builder()
                .id("A")
                .attributes(NodeAttributes.builder().stake(500.0).paymentHistory(20.0).activityRecency(BASE_TIME).build())
                .build();
        GraphSnapshot graph = snapshot(List.of(a, node("B")),
                List.of(edge("A", "B", 0.7, BASE_TIME - DAY_MS)));
        ReputationResult result = ReputationResult.builder()
                .scores(Map.of("A", ReputationScore.builder().nodeId("A").finalScore(123.0).build()))
                .sybilProbabilities(Map.of("A", 0.25, "B", 0.75))
                .build();
        Map<String, AccountAttributes> raw = Map.of("A", AccountAttributes.builder()
                .emailDomain("corp.example")
                .stake(900.0)
                .build());

        List<Account> accounts = assembler.toAccounts(graph, result, raw);

        assertThat(accounts).extracting(Account::getAccountId).containsExactly("A", "B");
        Account first = accounts.get(0);
        assertThat(first.getReputation()).isEqualTo(123.0);
        assertThat(first.getSybilProbability()).isEqualTo(0.25);
        assertThat(first.getConnections()).hasSize(1);
        assertThat(first.getConnections().get(0).getTarget()).isEqualTo("B");
        assertThat(first.getConnections().get(0).getWeight()).isEqualTo(0.7);
        assertThat(first.getContributions()).extracting(Contribution::getType)
                .containsExactly("edge:ENDORSE", "activity");
        assertThat(first.getAttributes().getEmailDomain()).isEqualTo("corp.example");
        assertThat(first.getAttributes().getStake()).isEqualTo(900.0);
        assertThat(first.getAttributes().getPaymentHistory()).isEqualTo(20.0);

        Account second = accounts.get(1);
        assertThat(second.getReputation()).isNull();
        assertThat(second.getSybilProbability()).isEqualTo(0.75);
        assertThat(second.getConnections()).isEmpty();
        assertThat(second.getContributions()).isEmpty();
    }

    @Test
    void toAccounts_withoutRawAttributesOrProbabilities() {
        ReputationResult result = ReputationResult.builder().scores(Map.of()).build();

        List<Account> accounts = assembler.toAccounts(triangleRing(), result, null);

        assertThat(accounts).hasSize(3);
        assertThat(accounts).allMatch(account -> account.getSybilProbability() == null);
        assertThat(accounts.get(0).getAttributes().getEmailDomain()).isNull();
    }
}
