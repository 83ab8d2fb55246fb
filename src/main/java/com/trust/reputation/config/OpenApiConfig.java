package com.trust.reputation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI trustGraphOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Trust Graph Reputation API")
                        .version("1.0.0")
                        .description(
                                "Reputation scoring and Sybil-cluster detection over an account interaction graph.\n\n" +
                                "**Scoring Pipeline:**\n" +
                                "1. Validate the graph snapshot via `POST /reputation/compute`\n" +
                                "2. Apply temporal decay and economic boosts to edge weights\n" +
                                "3. Run PageRank with a stake/payment-biased teleport vector\n" +
                                "4. Combine graph, quality, stake and payment sub-scores into a hybrid score\n" +
                                "5. Rank, audit fairness, estimate Sybil probabilities and optionally audit edge sensitivity\n\n" +
                                "**Clustering Methods:**\n" +
                                "- `CONNECTIVITY` (default): union-find over pairs above the similarity threshold\n" +
                                "- `SIMILARITY`: connected components of the similarity graph\n" +
                                "- `DBSCAN`: density-based clustering with similarity as distance\n" +
                                "- `HIERARCHICAL`: average-linkage agglomerative clustering\n\n" +
                                "Sybil probabilities and cluster risk scores are ranked heuristic signals. " +
                                "They require a separate policy threshold and are never a verdict on their own.")
                        .contact(new Contact().name("Trust Graph Team")));
    }
}
