package com.claimstrategy.common.scenario;

import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;
import com.claimstrategy.common.model.OpponentProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Materializes the seven canonical scenarios for one claim.
 *
 * <h3>Formulas (cs = case strength 0..10)</h3>
 * <pre>
 *   DEFAULT_JUDGMENT      p=0.15                 value=aggressive          cost= 1,000  60d
 *   EARLY_SETTLEMENT      p=0.25 + bonus         value=conservative x 0.65 cost= 2,500  90d
 *   MID_SETTLEMENT        p=0.35 + bonus         value=recommended x 0.85  cost= 8,000 240d
 *   LATE_SETTLEMENT       p=0.30 + bonus         value=recommended x 0.90  cost=12,000 330d
 *   TRIAL_WIN             p=cs/10 x 0.65         value=aggressive          cost=15,000 365d
 *   TRIAL_LOSS            p=(10-cs)/10 x 0.35    value=0                   cost=15,000 365d
 *   SUMMARY_JUDGMENT_WIN  p=cs&gt;7 ? 0.30 : 0.10   value=aggressive          cost= 5,000 180d
 * </pre>
 *
 * <p>The trial-win weight is {@code cs/10 x 0.65}, not {@code cs/10 x 0.75 x 0.65}: the
 * simulator's 0.75 trial-win cap is not applied here, so ranked probabilities and
 * simulated shares differ for trial outcomes.
 *
 * <p>{@code bonus} is {@value #SETTLEMENT_BONUS} when the opponent settles more than
 * {@value #SETTLEMENT_PRONE_RATE} of its cases, otherwise 0.
 *
 * <p>Stateless. Never fails for validated inputs.
 */
public final class ScenarioCatalog {

    public static final double SETTLEMENT_BONUS      = 0.10;
    public static final double SETTLEMENT_PRONE_RATE = 0.6;

    /**
     * @param damages  validated damages range
     * @param strength validated case strength
     * @param opponent opponent profile; {@link OpponentProfile#unknown()} when absent
     * @return scenarios in {@link ScenarioType} declaration order
     */
    public List<Scenario> materialize(DamagesRange damages, CaseStrength strength, OpponentProfile opponent) {
        double bonus = settlementBonus(opponent);
        List<Scenario> scenarios = new ArrayList<>(ScenarioType.values().length);
        for (ScenarioType type : ScenarioType.values()) {
            scenarios.add(new Scenario(
                type,
                probability(type, strength, bonus),
                value(type, damages),
                cost(type),
                durationDays(type)));
        }
        return List.copyOf(scenarios);
    }

    public List<Scenario> materialize(DamagesRange damages, CaseStrength strength) {
        return materialize(damages, strength, OpponentProfile.unknown());
    }

    static double settlementBonus(OpponentProfile opponent) {
        return opponent != null && opponent.settlementRate() > SETTLEMENT_PRONE_RATE
            ? SETTLEMENT_BONUS : 0.0;
    }

    static double probability(ScenarioType type, CaseStrength strength, double bonus) {
        double p = switch (type) {
            case DEFAULT_JUDGMENT     -> 0.15;
            case EARLY_SETTLEMENT     -> 0.25 + bonus;
            case MID_SETTLEMENT       -> 0.35 + bonus;
            case LATE_SETTLEMENT      -> 0.30 + bonus;
            case TRIAL_WIN            -> strength.fraction() * 0.65;
            case TRIAL_LOSS           -> (1.0 - strength.fraction()) * 0.35;
            case SUMMARY_JUDGMENT_WIN -> strength.isStrong() ? 0.30 : 0.10;
        };
        return Math.min(1.0, p);
    }

    /** The per-type value function applied to the damages range. */
    public static double value(ScenarioType type, DamagesRange damages) {
        return switch (type) {
            case DEFAULT_JUDGMENT, TRIAL_WIN, SUMMARY_JUDGMENT_WIN -> damages.aggressive();
            case EARLY_SETTLEMENT -> damages.conservative() * 0.65;
            case MID_SETTLEMENT   -> damages.recommended() * 0.85;
            case LATE_SETTLEMENT  -> damages.recommended() * 0.90;
            case TRIAL_LOSS       -> 0.0;
        };
    }

    static double cost(ScenarioType type) {
        return switch (type) {
            case DEFAULT_JUDGMENT     -> 1_000;
            case EARLY_SETTLEMENT     -> 2_500;
            case MID_SETTLEMENT       -> 8_000;
            case LATE_SETTLEMENT      -> 12_000;
            case TRIAL_WIN, TRIAL_LOSS -> 15_000;
            case SUMMARY_JUDGMENT_WIN -> 5_000;
        };
    }

    static int durationDays(ScenarioType type) {
        return switch (type) {
            case DEFAULT_JUDGMENT     -> 60;
            case EARLY_SETTLEMENT     -> 90;
            case MID_SETTLEMENT       -> 240;
            case LATE_SETTLEMENT      -> 330;
            case TRIAL_WIN, TRIAL_LOSS -> 365;
            case SUMMARY_JUDGMENT_WIN -> 180;
        };
    }
}
