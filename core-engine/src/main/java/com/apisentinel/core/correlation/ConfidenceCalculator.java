package com.apisentinel.core.correlation;

import com.apisentinel.core.model.AnomalyCandidate;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Correlation confidence of a set of anomaly candidates.
 *
 * <p>
 * Each candidate contributes an individual confidence of
 * {@code 0.9 × score / 100}. Members combine as independent evidence, and
 * every additional environment halves the remaining doubt:
 * </p>
 *
 * <pre>
 *   confidence = 1 − Π(1 − cᵢ) × 0.5^(E − 1)
 * </pre>
 *
 * <p>
 * With two or more members the result is strictly greater than every
 * member's individual confidence.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfidenceCalculator {

    private static final double MAX_INDIVIDUAL = 0.9;

    private ConfidenceCalculator() {
        // utility class
    }

    public static double individual(AnomalyCandidate candidate) {
        return MAX_INDIVIDUAL * candidate.getDeviationScore() / 100.0;
    }

    public static double combined(Collection<AnomalyCandidate> members) {
        if (members.isEmpty()) {
            return 0.0;
        }
        double doubt = 1.0;
        Set<String> environments = new HashSet<>();
        for (AnomalyCandidate member : members) {
            doubt *= 1.0 - individual(member);
            environments.add(member.getEnvironment());
        }
        doubt *= Math.pow(0.5, environments.size() - 1);
        return 1.0 - doubt;
    }
}
