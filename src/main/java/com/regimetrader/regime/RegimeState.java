package com.regimetrader.regime;

import com.regimetrader.domain.enums.MarketRegime;
import lombok.Getter;

/**
 * Mutable classification state owned by one engine instance and passed explicitly to
 * {@link RegimeClassifier#classify}. Independent engines never share an instance.
 */
@Getter
public class RegimeState {

    private MarketRegime currentRegime = MarketRegime.CALIBRATING;
    private MarketRegime previousRegime = MarketRegime.CALIBRATING;

    /** Consecutive classifications that returned {@link #currentRegime}, minus one. */
    private long regimeDuration;

    /** Remaining steps of post-crash caution while in RECOVERY. */
    private int crashCooldown;

    /** True when the latest classification changed the regime. */
    public boolean isTransition() {
        return currentRegime != previousRegime;
    }

    void advance(MarketRegime next) {
        previousRegime = currentRegime;
        currentRegime = next;
        regimeDuration = next == previousRegime ? regimeDuration + 1 : 0;
    }

    void setCrashCooldown(int crashCooldown) {
        this.crashCooldown = crashCooldown;
    }

    @Override
    public String toString() {
        return "RegimeState{current=" + currentRegime + ", previous=" + previousRegime
                + ", duration=" + regimeDuration + ", cooldown=" + crashCooldown + "}";
    }
}
