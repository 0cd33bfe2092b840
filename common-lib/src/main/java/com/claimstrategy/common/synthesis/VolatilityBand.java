package com.claimstrategy.common.synthesis;

/**
 * Spread of simulated recoveries.
 * <ul>
 *   <li>{@link #HIGH}   — stdDev &gt; 20,000</li>
 *   <li>{@link #MEDIUM} — stdDev &gt; 10,000</li>
 *   <li>{@link #LOW}    — otherwise</li>
 * </ul>
 */
public enum VolatilityBand {
    HIGH,
    MEDIUM,
    LOW;

    public static VolatilityBand of(double stdDev) {
        if (stdDev > 20_000) return HIGH;
        if (stdDev > 10_000) return MEDIUM;
        return LOW;
    }
}
