package com.claimstrategy.engine.service;

import com.claimstrategy.common.model.DamagesRange;

/**
 * Inputs of one analysis call.
 *
 * @param damages                required damages range
 * @param caseStrength           raw score; clamped into [0, 10] with a warning
 * @param opponentSettlementRate nullable, defaults to 0.5
 * @param trials                 nullable, defaults to the configured trial count
 * @param seed                   nullable; when present the run is reproducible
 * @param retainTrials           nullable, defaults to the configured retention flag;
 *                               when true the raw trial records are kept in the result
 */
public record AnalysisRequest(
    DamagesRange damages,
    int caseStrength,
    Double opponentSettlementRate,
    Integer trials,
    Long seed,
    Boolean retainTrials
) {
    public AnalysisRequest(DamagesRange damages, int caseStrength, Double opponentSettlementRate,
                           Integer trials, Long seed) {
        this(damages, caseStrength, opponentSettlementRate, trials, seed, null);
    }

    public static AnalysisRequest of(DamagesRange damages, int caseStrength) {
        return new AnalysisRequest(damages, caseStrength, null, null, null, null);
    }

    public AnalysisRequest withOpponentSettlementRate(double rate) {
        return new AnalysisRequest(damages, caseStrength, rate, trials, seed, retainTrials);
    }

    public AnalysisRequest withTrials(int trialCount) {
        return new AnalysisRequest(damages, caseStrength, opponentSettlementRate, trialCount, seed, retainTrials);
    }

    public AnalysisRequest withSeed(long fixedSeed) {
        return new AnalysisRequest(damages, caseStrength, opponentSettlementRate, trials, fixedSeed, retainTrials);
    }

    public AnalysisRequest withRetainedTrials() {
        return new AnalysisRequest(damages, caseStrength, opponentSettlementRate, trials, seed, true);
    }
}
