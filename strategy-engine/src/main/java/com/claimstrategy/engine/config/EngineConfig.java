package com.claimstrategy.engine.config;

import com.claimstrategy.common.equilibrium.BestResponseSelector;
import com.claimstrategy.common.scenario.ScenarioCatalog;
import com.claimstrategy.common.simulation.MonteCarloSimulator;
import com.claimstrategy.common.simulation.SimulationParameters;
import com.claimstrategy.common.synthesis.StrategySynthesizer;
import com.claimstrategy.common.tree.DecisionTreeBuilder;
import com.claimstrategy.common.valuation.ExpectedValueEvaluator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the pure engines from common-lib as singletons. They are stateless, so
 * one instance serves every analysis.
 */
@Configuration
public class EngineConfig {

    @Value("${engine.simulation.max-trial-win-probability:0.75}")
    private double maxTrialWinProbability;

    @Bean
    public ScenarioCatalog scenarioCatalog() {
        return new ScenarioCatalog();
    }

    @Bean
    public DecisionTreeBuilder decisionTreeBuilder() {
        return new DecisionTreeBuilder();
    }

    @Bean
    public ExpectedValueEvaluator expectedValueEvaluator() {
        return new ExpectedValueEvaluator();
    }

    @Bean
    public BestResponseSelector bestResponseSelector() {
        return new BestResponseSelector();
    }

    @Bean
    public StrategySynthesizer strategySynthesizer() {
        return new StrategySynthesizer();
    }

    @Bean
    public MonteCarloSimulator monteCarloSimulator() {
        SimulationParameters defaults = SimulationParameters.defaults();
        SimulationParameters params = new SimulationParameters(
            defaults.defaultThreshold(),
            defaults.earlySettlementThreshold(),
            defaults.midSettlementThreshold(),
            defaults.summaryJudgmentThreshold(),
            defaults.lateSettlementThreshold(),
            maxTrialWinProbability,
            defaults.branches());
        return new MonteCarloSimulator(params);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler simulationScheduler(@Value("${engine.simulation.parallelism:1}") int parallelism) {
        return Schedulers.newParallel("mc-trials", Math.max(1, parallelism));
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
