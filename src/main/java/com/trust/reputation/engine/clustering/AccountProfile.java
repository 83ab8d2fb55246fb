package com.trust.reputation.engine.clustering;

import com.trust.reputation.model.Account;
import com.trust.reputation.model.AccountAttributes;
import com.trust.reputation.model.Connection;
import com.trust.reputation.model.Contribution;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-account feature inputs, derived once per run so pairwise comparison does no
 * repeated parsing.
 */
final class AccountProfile {

    static final String EMAIL_DOMAIN = "emailDomain";
    static final String REGISTRATION_DATE = "registrationDate";

    private final Account account;
    private final Set<String> targets;
    private final Set<Long> activityWindows;
    private final TreeMap<String, Object> metadata;

    private AccountProfile(Account account, Set<String> targets, Set<Long> activityWindows,
                           TreeMap<String, Object> metadata) {
        this.account = account;
        this.targets = targets;
        this.activityWindows = activityWindows;
        this.metadata = metadata;
    }

    static AccountProfile of(Account account, long temporalWindowMs) {
        Set<String> targets = new HashSet<>();
        for (Connection connection : account.connectionsOrEmpty()) {
            targets.add(connection.getTarget());
        }
        Set<Long> windows = new HashSet<>();
        for (Contribution contribution : account.contributionsOrEmpty()) {
            windows.add(Math.floorDiv(contribution.getTimestamp(), temporalWindowMs));
        }
        return new AccountProfile(account, Collections.unmodifiableSet(targets),
                Collections.unmodifiableSet(windows), metadataOf(account.getAttributes()));
    }

    // Sorted so every pairwise comparison visits keys in the same order
    private static TreeMap<String, Object> metadataOf(AccountAttributes attrs) {
        TreeMap<String, Object> metadata = new TreeMap<>();
        if (attrs == null) {
            return metadata;
        }
        if (attrs.getExtensions() != null) {
            for (Map.Entry<String, Object> entry : attrs.getExtensions().entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    metadata.put(entry.getKey(), entry.getValue());
                }
            }
        }
        putIfPresent(metadata, EMAIL_DOMAIN, attrs.getEmailDomain());
        putIfPresent(metadata, REGISTRATION_DATE, attrs.getRegistrationDate());
        putIfPresent(metadata, "activityLevel", attrs.getActivityLevel());
        putIfPresent(metadata, "stake", attrs.getStake());
        putIfPresent(metadata, "paymentHistory", attrs.getPaymentHistory());
        return metadata;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value instanceof String s && s.isBlank()) {
            return;
        }
        if (value != null) {
            metadata.put(key, value);
        }
    }

    Account account() {
        return account;
    }

    String id() {
        return account.getAccountId();
    }

    Set<String> targets() {
        return targets;
    }

    Set<Long> activityWindows() {
        return activityWindows;
    }

    TreeMap<String, Object> metadata() {
        return metadata;
    }

    boolean hasConnections() {
        return !targets.isEmpty();
    }

    boolean hasContributions() {
        return !activityWindows.isEmpty();
    }

    boolean hasMetadata() {
        return !metadata.isEmpty();
    }

    boolean connectsTo(AccountProfile other) {
        return targets.contains(other.id());
    }
}
