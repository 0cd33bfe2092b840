package com.claimstrategy.common.equilibrium;

/**
 * @param claimantStrategy  claimant best response
 * @param opponentStrategy  inferred opponent strategy
 * @param reasoning         short explanation of the pairing
 * @param payoffMatrix      matrix the response was read from
 */
public record EquilibriumResult(
    ClaimantStrategy claimantStrategy,
    OpponentStrategy opponentStrategy,
    String reasoning,
    PayoffMatrix payoffMatrix
) {}
