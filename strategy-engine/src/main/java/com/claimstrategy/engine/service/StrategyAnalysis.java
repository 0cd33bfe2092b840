package com.claimstrategy.engine.service;

import com.claimstrategy.common.equilibrium.EquilibriumResult;
import com.claimstrategy.common.scenario.Scenario;
import com.claimstrategy.common.simulation.SimulationResult;
import com.claimstrategy.common.synthesis.Recommendation;
import com.claimstrategy.common.tree.TreeNode;
import com.claimstrategy.common.valuation.ExpectedValueReport;

import java.util.List;

/**
 * Everything one analysis produced, for callers that want to explain the
 * recommendation rather than just consume it.
 *
 * @param seed master seed the simulation ran with, supplied or generated
 */
public record StrategyAnalysis(
    String analysisId,
    long seed,
    List<Scenario> scenarios,
    TreeNode decisionTree,
    ExpectedValueReport expectedValues,
    EquilibriumResult equilibrium,
    SimulationResult simulation,
    Recommendation recommendation
) {}
