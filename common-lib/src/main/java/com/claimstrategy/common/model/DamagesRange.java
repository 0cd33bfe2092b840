package com.claimstrategy.common.model;

import com.claimstrategy.common.exception.InvalidDamagesRangeException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable damages estimate supplied by the upstream damages step.
 *
 * <p>Invariant: {@code 0 <= conservative <= recommended <= aggressive}, all finite.
 * Enforced on construction; there is no way to hold an unordered range.
 */
public record DamagesRange(
    @JsonProperty("conservative") double conservative,
    @JsonProperty("recommended")  double recommended,
    @JsonProperty("aggressive")   double aggressive
) {
    public DamagesRange {
        requireAmount("conservative", conservative);
        requireAmount("recommended", recommended);
        requireAmount("aggressive", aggressive);
        if (conservative > recommended || recommended > aggressive) {
            throw new InvalidDamagesRangeException(String.format(
                "expected conservative <= recommended <= aggressive but got %.2f / %.2f / %.2f",
                conservative, recommended, aggressive));
        }
    }

    public static DamagesRange of(double conservative, double recommended, double aggressive) {
        return new DamagesRange(conservative, recommended, aggressive);
    }

    private static void requireAmount(String field, double amount) {
        if (!Double.isFinite(amount) || amount < 0.0) {
            throw new InvalidDamagesRangeException(
                field + " must be a finite, non-negative amount but was " + amount);
        }
    }
}
