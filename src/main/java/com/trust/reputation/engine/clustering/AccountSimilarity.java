package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.config.FeatureWeights;
import com.trust.reputation.model.PairFeatures;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pairwise account similarity in [0, 1] from five weighted features.
 * <p>
 * A feature family only counts when at least one of the two accounts carries data
 * for it (connections, contributions or attributes); the weighted sum is renormalized
 * over the families that count. Every step is order-independent, so
 * {@code similarity(a, b) == similarity(b, a)} holds exactly.
 */
public class AccountSimilarity {

    private final FeatureWeights weights;
    private final int sharedConnectionsCap;
    private final long registrationWindowMs;
    private final int maxGraphDistance;

    public AccountSimilarity(ClusteringConfig config) {
        this.weights = config.getFeatureWeights();
        this.sharedConnectionsCap = config.getSharedConnectionsCap();
        this.registrationWindowMs = config.getRegistrationWindowMs();
        this.maxGraphDistance = config.getMaxGraphDistance();
    }

    PairFeatures features(AccountProfile a, AccountProfile b) {
        int shared = intersectionSize(a.targets(), b.targets());
        int windowsShared = intersectionSize(a.activityWindows(), b.activityWindows());
        boolean direct = a.connectsTo(b) || b.connectsTo(a);
        return PairFeatures.builder()
                .sharedConnections(shared)
                .connectionOverlap(jaccard(shared, a.targets().size(), b.targets().size()))
                .temporalSimilarity(jaccard(windowsShared, a.activityWindows().size(), b.activityWindows().size()))
                .metadataSimilarity(metadataSimilarity(a, b))
                .graphDistance(direct ? 1 : PairFeatures.UNKNOWN_DISTANCE)
                .build();
    }

    double similarity(AccountProfile a, AccountProfile b) {
        return combine(features(a, b), a.hasConnections() || b.hasConnections(),
                a.hasContributions() || b.hasContributions(), a.hasMetadata() || b.hasMetadata());
    }

    double combine(PairFeatures f, boolean connectionData, boolean temporalData, boolean metadataData) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        if (connectionData) {
            weighted += weights.getSharedConnections()
                    * Math.min(1.0, f.getSharedConnections() / (double) sharedConnectionsCap);
            weighted += weights.getConnectionOverlap() * f.getConnectionOverlap();
            weighted += weights.getGraphDistance() * normalizedDistance(f.getGraphDistance());
            totalWeight += weights.getSharedConnections() + weights.getConnectionOverlap() + weights.getGraphDistance();
        }
        if (temporalData) {
            weighted += weights.getTemporalSimilarity() * f.getTemporalSimilarity();
            totalWeight += weights.getTemporalSimilarity();
        }
        if (metadataData) {
            weighted += weights.getMetadataSimilarity() * f.getMetadataSimilarity();
            totalWeight += weights.getMetadataSimilarity();
        }
        if (totalWeight <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, weighted / totalWeight));
    }

    private double normalizedDistance(int distance) {
        if (distance <= 0 || distance > maxGraphDistance) {
            return 0.0;
        }
        return 1.0 - (double) distance / maxGraphDistance;
    }

    double metadataSimilarity(AccountProfile a, AccountProfile b) {
        Set<String> keys = new TreeSet<>(a.metadata().keySet());
        keys.addAll(b.metadata().keySet());
        if (keys.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (String key : keys) {
            Object left = a.metadata().get(key);
            Object right = b.metadata().get(key);
            if (left != null && right != null) {
                total += valueSimilarity(key, left, right);
            }
        }
        return total / keys.size();
    }

    private double valueSimilarity(String key, Object left, Object right) {
        if (AccountProfile.REGISTRATION_DATE.equals(key) && left instanceof Number l && right instanceof Number r) {
            double delta = Math.abs(l.doubleValue() - r.doubleValue());
            return Math.max(0.0, 1.0 - delta / registrationWindowMs);
        }
        if (left instanceof Number l && right instanceof Number r) {
            double x = l.doubleValue();
            double y = r.doubleValue();
            double scale = Math.max(Math.max(Math.abs(x), Math.abs(y)), 1.0);
            return Math.max(0.0, 1.0 - Math.abs(x - y) / scale);
        }
        if (left instanceof String l && right instanceof String r) {
            return stringSimilarity(l, r);
        }
        return left.equals(right) ? 1.0 : 0.0;
    }

    // Exact match 1, addresses on the same mail domain 0.5
    private static double stringSimilarity(String left, String right) {
        String l = left.trim().toLowerCase(Locale.ROOT);
        String r = right.trim().toLowerCase(Locale.ROOT);
        if (l.equals(r)) {
            return 1.0;
        }
        int la = l.lastIndexOf('@');
        int ra = r.lastIndexOf('@');
        if (la >= 0 && ra >= 0 && l.substring(la + 1).equals(r.substring(ra + 1)) && la + 1 < l.length()) {
            return 0.5;
        }
        return 0.0;
    }

    private static <T> int intersectionSize(Set<T> a, Set<T> b) {
        Set<T> smaller = a.size() <= b.size() ? a : b;
        Set<T> larger = smaller == a ? b : a;
        int count = 0;
        for (T item : smaller) {
            if (larger.contains(item)) {
                count++;
            }
        }
        return count;
    }

    private static double jaccard(int intersection, int sizeA, int sizeB) {
        int union = sizeA + sizeB - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }
}
