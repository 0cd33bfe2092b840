package com.claimstrategy.engine;

import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.synthesis.Recommendation;
import com.claimstrategy.engine.service.StrategyAnalysisService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "engine.simulation.default-trials=2000",
    "engine.simulation.parallelism=2"
})
class StrategyEngineApplicationTest {

    @Autowired
    private StrategyAnalysisService service;

    @Test
    @DisplayName("context wires the engine and runs a default analysis")
    void analyzesWithConfiguredDefaults() {
        Recommendation rec = service.analyze(DamagesRange.of(30_000, 50_000, 75_000), 8);

        assertNotNull(rec);
        assertTrue(rec.winProbability() > 0.7);
        assertEquals(5, rec.tactics().size());
    }
}
