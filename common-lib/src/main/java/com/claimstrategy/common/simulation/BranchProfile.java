package com.claimstrategy.common.simulation;

/**
 * Gaussian sampling profile of one simulated branch. The value mean comes from the
 * scenario catalog's value function; days and cost means are fixed per branch.
 *
 * @param valueStdDev spread of the recovered amount
 * @param meanDays    mean duration
 * @param daysStdDev  spread of the duration
 * @param meanCost    mean litigation cost
 * @param costStdDev  spread of the cost
 */
public record BranchProfile(
    double valueStdDev,
    double meanDays,
    double daysStdDev,
    double meanCost,
    double costStdDev
) {}
