package com.regimetrader.regime;

import lombok.Getter;
import lombok.Setter;

/**
 * Threshold set used by {@link RegimeClassifier}, bound from {@code regimetrader.regime.*}.
 *
 * <p>Defaults are the compound set: lower single thresholds for CRASH plus pairwise
 * combinations of moderately elevated signals. The simpler set (spread ratio 2.5,
 * momentum 0.15, imbalance 0.6, compound checks off) is selected purely through configuration.
 *
 * <p>STRESSED and HFT each carry an enter and a looser stay threshold to give hysteresis.
 */
@Getter
@Setter
public class RegimeThresholds {

    private Crash crash = new Crash();
    private Recovery recovery = new Recovery();
    private Stressed stressed = new Stressed();
    private Hft hft = new Hft();

    @Getter
    @Setter
    public static class Crash {

        private double spreadRatio = 2.0;
        private double momentum = 0.10;
        private double imbalance = 0.5;

        /** Whether the pairwise compound checks below are evaluated at all. */
        private boolean compoundEnabled = true;

        /** Spread ratio level used by both spread-based pairs. */
        private double compoundSpreadRatio = 1.8;

        /** Momentum paired with {@link #compoundSpreadRatio}. */
        private double compoundMomentum = 0.06;

        /** Imbalance paired with {@link #compoundSpreadRatio}. */
        private double compoundImbalance = 0.4;

        /** Momentum and imbalance levels of the momentum+imbalance pair. */
        private double pairedMomentum = 0.08;

        private double pairedImbalance = 0.45;
    }

    @Getter
    @Setter
    public static class Recovery {

        /** Leave CRASH for RECOVERY once the spread ratio falls below this. */
        private double enterSpreadRatio = 1.8;

        /** Steps of mandatory caution after a crash. */
        private int cooldownSteps = 100;

        /** Once the cooldown has run out, return to NORMAL below this spread ratio. */
        private double exitSpreadRatio = 1.5;
    }

    @Getter
    @Setter
    public static class Stressed {

        private double enterSpreadRatio = 1.5;
        private double enterImbalance = 0.4;
        private double enterDepthRatio = 0.5;

        private double staySpreadRatio = 1.2;
        private double stayImbalance = 0.3;
        private double stayDepthRatio = 0.6;
    }

    @Getter
    @Setter
    public static class Hft {

        private double maxSpreadRatio = 1.6;
        private double minDepthRatio = 0.4;
        private double maxMomentum = 0.08;

        private double enterChurn = 0.20;
        private double stayChurn = 0.12;
    }
}
