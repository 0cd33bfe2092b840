package com.claimstrategy.common.synthesis;

import com.claimstrategy.common.equilibrium.ClaimantStrategy;
import com.claimstrategy.common.equilibrium.OpponentStrategy;
import com.claimstrategy.common.scenario.ScenarioType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The engine's only externally consumed output. Immutable, produced once per analysis.
 *
 * <p>Monetary figures are rounded to whole units; {@code winProbability} and the
 * {@code outcomeShares} values are fractions in [0.0, 1.0]. {@code outcomeShares}
 * iterates in {@link ScenarioType} declaration order.
 */
public record Recommendation(
    @JsonProperty("primaryStrategy")     String primaryStrategy,
    @JsonProperty("claimantStrategy")    ClaimantStrategy claimantStrategy,
    @JsonProperty("opponentStrategy")    OpponentStrategy opponentStrategy,
    @JsonProperty("equilibriumReasoning") String equilibriumReasoning,
    @JsonProperty("expectedValue")       long expectedValue,
    @JsonProperty("winProbability")      double winProbability,
    @JsonProperty("outcomeShares")       Map<ScenarioType, Double> outcomeShares,
    @JsonProperty("demandStrategy")      DemandStrategy demandStrategy,
    @JsonProperty("timing")              TimingGuidance timing,
    @JsonProperty("tactics")             List<String> tactics,
    @JsonProperty("riskAssessment")      RiskAssessment riskAssessment,
    @JsonProperty("bottomLine")          String bottomLine
) {
    public Recommendation {
        tactics = List.copyOf(tactics);
        EnumMap<ScenarioType, Double> shares = new EnumMap<>(ScenarioType.class);
        shares.putAll(outcomeShares);
        outcomeShares = Collections.unmodifiableMap(shares);
    }

    /**
     * Percentile anchors for negotiation.
     *
     * @param demandAnchor    75th percentile, the opening demand
     * @param targetSettlement median
     * @param acceptanceFloor 25th percentile, the walk-away floor
     */
    public record DemandStrategy(
        @JsonProperty("demandAnchor")     long demandAnchor,
        @JsonProperty("targetSettlement") long targetSettlement,
        @JsonProperty("acceptanceFloor")  long acceptanceFloor,
        @JsonProperty("reasoning")        String reasoning
    ) {}

    public record TimingGuidance(
        @JsonProperty("optimalSettlement")     String optimalSettlement,
        @JsonProperty("estimatedDurationDays") long estimatedDurationDays,
        @JsonProperty("estimatedCost")         long estimatedCost
    ) {}

    /**
     * @param bestCase   90th percentile
     * @param mostLikely median
     * @param worstCase  10th percentile
     */
    public record RiskAssessment(
        @JsonProperty("bestCase")   long bestCase,
        @JsonProperty("mostLikely") long mostLikely,
        @JsonProperty("worstCase")  long worstCase,
        @JsonProperty("volatility") VolatilityBand volatility
    ) {}
}
