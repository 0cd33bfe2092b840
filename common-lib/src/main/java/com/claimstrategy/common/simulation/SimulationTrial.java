package com.claimstrategy.common.simulation;

import com.claimstrategy.common.scenario.ScenarioType;

/** One simulated case outcome. */
public record SimulationTrial(
    ScenarioType scenarioType,
    double value,
    double timeDays,
    double cost
) {}
