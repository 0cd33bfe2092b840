package com.claimstrategy.common.scenario;

/**
 * One materialized terminal outcome for a specific claim.
 *
 * <p>{@code baseProbability} is the likelihood of the path conditioned on reaching
 * its branch. Probabilities across the catalog are not a partition and do not sum
 * to one; distribution-level figures come from the Monte Carlo run instead.
 *
 * @param type            canonical outcome
 * @param baseProbability conditional path likelihood in [0.0, 1.0]
 * @param value           gross recovery
 * @param cost            litigation cost to reach the outcome
 * @param durationDays    elapsed days to reach the outcome
 */
public record Scenario(
    ScenarioType type,
    double baseProbability,
    double value,
    double cost,
    int durationDays
) {
    public String label() {
        return type.label();
    }
}
