package com.claimstrategy.engine.service;

import com.claimstrategy.common.equilibrium.BestResponseSelector;
import com.claimstrategy.common.equilibrium.EquilibriumResult;
import com.claimstrategy.common.exception.InvalidDamagesRangeException;
import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.model.OpponentProfile;
import com.claimstrategy.common.scenario.Scenario;
import com.claimstrategy.common.scenario.ScenarioCatalog;
import com.claimstrategy.common.simulation.MonteCarloSimulator;
import com.claimstrategy.common.simulation.RandomStreams;
import com.claimstrategy.common.simulation.SimulationResult;
import com.claimstrategy.common.simulation.SimulationStatistics;
import com.claimstrategy.common.synthesis.Recommendation;
import com.claimstrategy.common.synthesis.StrategySynthesizer;
import com.claimstrategy.common.tree.DecisionTreeBuilder;
import com.claimstrategy.common.tree.TreeNode;
import com.claimstrategy.common.valuation.ExpectedValueEvaluator;
import com.claimstrategy.common.valuation.ExpectedValueReport;
import com.claimstrategy.engine.logger.AnalysisFlowLogger;
import com.claimstrategy.engine.simulation.ParallelTrialRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Entry point of the strategy engine.
 *
 * <p>Flow: validate → materialize scenarios → build tree → rank by expected value
 * → select best response → simulate → synthesize.
 *
 * <p>Every validation error is raised before any computation starts and no partial
 * result is returned. An out-of-range case strength is clamped with a warning, and a
 * trial count above the configured warning threshold is logged but honored.
 *
 * <p>CPU-bound and free of I/O. Any timeout belongs to the caller.
 */
@Service
public class StrategyAnalysisService {

    private final ScenarioCatalog scenarioCatalog;
    private final DecisionTreeBuilder decisionTreeBuilder;
    private final ExpectedValueEvaluator expectedValueEvaluator;
    private final BestResponseSelector bestResponseSelector;
    private final MonteCarloSimulator monteCarloSimulator;
    private final ParallelTrialRunner parallelTrialRunner;
    private final StrategySynthesizer strategySynthesizer;
    private final AnalysisFlowLogger flowLogger;

    private final int defaultTrials;
    private final long largeTrialWarning;
    private final int parallelism;
    private final boolean retainTrials;

    public StrategyAnalysisService(
            ScenarioCatalog scenarioCatalog,
            DecisionTreeBuilder decisionTreeBuilder,
            ExpectedValueEvaluator expectedValueEvaluator,
            BestResponseSelector bestResponseSelector,
            MonteCarloSimulator monteCarloSimulator,
            ParallelTrialRunner parallelTrialRunner,
            StrategySynthesizer strategySynthesizer,
            AnalysisFlowLogger flowLogger,
            @Value("${engine.simulation.default-trials:10000}") int defaultTrials,
            @Value("${engine.simulation.large-trial-warning:1000000}") long largeTrialWarning,
            @Value("${engine.simulation.parallelism:1}") int parallelism,
            @Value("${engine.simulation.retain-trials:false}") boolean retainTrials) {
        this.scenarioCatalog        = scenarioCatalog;
        this.decisionTreeBuilder    = decisionTreeBuilder;
        this.expectedValueEvaluator = expectedValueEvaluator;
        this.bestResponseSelector   = bestResponseSelector;
        this.monteCarloSimulator    = monteCarloSimulator;
        this.parallelTrialRunner    = parallelTrialRunner;
        this.strategySynthesizer    = strategySynthesizer;
        this.flowLogger             = flowLogger;
        this.defaultTrials          = defaultTrials;
        this.largeTrialWarning      = largeTrialWarning;
        this.parallelism            = parallelism;
        this.retainTrials           = retainTrials;
    }

    public Recommendation analyze(DamagesRange damages, int caseStrength) {
        return analyze(AnalysisRequest.of(damages, caseStrength));
    }

    public Recommendation analyze(DamagesRange damages, int caseStrength, Double opponentSettlementRate,
                                  Integer trials, Long seed) {
        return analyze(new AnalysisRequest(damages, caseStrength, opponentSettlementRate, trials, seed));
    }

    public Recommendation analyze(AnalysisRequest request) {
        return analyzeDetailed(request).recommendation();
    }

    public StrategyAnalysis analyzeDetailed(AnalysisRequest request) {
        String analysisId = UUID.randomUUID().toString();

        // ── validation: nothing is computed until every input is accepted ──────
        DamagesRange damages = request.damages();
        if (damages == null) {
            throw new InvalidDamagesRangeException("damages range is required");
        }
        OpponentProfile opponent = OpponentProfile.ofNullable(request.opponentSettlementRate());
        int trials = request.trials() != null ? request.trials() : defaultTrials;
        MonteCarloSimulator.requirePositive(trials);

        if (!CaseStrength.inRange(request.caseStrength())) {
            flowLogger.warn(analysisId, String.format(
                "caseStrength=%d outside [%d, %d], clamping",
                request.caseStrength(), CaseStrength.MIN, CaseStrength.MAX));
        }
        CaseStrength strength = CaseStrength.clamped(request.caseStrength());

        if (trials > largeTrialWarning) {
            flowLogger.warn(analysisId, String.format(
                "trials=%d exceeds %d, expect high memory use and run time", trials, largeTrialWarning));
        }
        long seed = request.seed() != null ? request.seed() : RandomStreams.randomSeed();
        boolean retain = request.retainTrials() != null ? request.retainTrials() : retainTrials;
        flowLogger.stage(AnalysisFlowLogger.REQUEST_VALIDATED, analysisId, String.format(
            "caseStrength=%d opponentSettlementRate=%.2f trials=%d seeded=%b retainTrials=%b",
            strength.value(), opponent.settlementRate(), trials, request.seed() != null, retain));

        // ── scenario model ─────────────────────────────────────────────────────
        List<Scenario> scenarios = scenarioCatalog.materialize(damages, strength, opponent);
        flowLogger.stage(AnalysisFlowLogger.SCENARIOS_MATERIALIZED, analysisId, "count=" + scenarios.size());

        // ── explanatory tree (not on the numeric path) ─────────────────────────
        TreeNode tree = decisionTreeBuilder.build(damages, strength);
        flowLogger.stage(AnalysisFlowLogger.TREE_BUILT, analysisId, "depth=" + tree.depth());

        // ── expected values ────────────────────────────────────────────────────
        ExpectedValueReport evReport = expectedValueEvaluator.evaluate(scenarios);
        flowLogger.stage(AnalysisFlowLogger.SCENARIOS_RANKED, analysisId, String.format(
            "optimal=%s expectedValue=%.0f", evReport.optimal().scenario().type(), evReport.optimal().expectedValue()));

        // ── best response ──────────────────────────────────────────────────────
        EquilibriumResult equilibrium = bestResponseSelector.select(evReport, opponent);
        flowLogger.stage(AnalysisFlowLogger.RESPONSE_SELECTED, analysisId, String.format(
            "opponent=%s response=%s", equilibrium.opponentStrategy().id(), equilibrium.claimantStrategy().id()));

        // ── Monte Carlo ────────────────────────────────────────────────────────
        SimulationResult simulation = parallelTrialRunner.run(
            monteCarloSimulator, damages, strength, trials, seed, parallelism, retain);
        SimulationStatistics stats = simulation.statistics();
        flowLogger.stage(AnalysisFlowLogger.SIMULATION_COMPLETED, analysisId, String.format(
            "trials=%d mean=%.0f median=%.0f winRate=%.3f", stats.trialCount(), stats.mean(), stats.median(),
            stats.winRate()));

        // ── synthesis ──────────────────────────────────────────────────────────
        Recommendation recommendation = strategySynthesizer.synthesize(evReport, equilibrium, simulation);
        flowLogger.stage(AnalysisFlowLogger.RECOMMENDATION_CREATED, analysisId,
            "primaryStrategy=" + recommendation.primaryStrategy());
        flowLogger.recommendation(recommendation, analysisId);

        return new StrategyAnalysis(analysisId, seed, scenarios, tree, evReport, equilibrium, simulation,
            recommendation);
    }
}
