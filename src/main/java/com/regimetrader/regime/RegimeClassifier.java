package com.regimetrader.regime;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.metrics.MarketMetrics;

/**
 * State machine mapping the current {@link MarketMetrics} to a {@link MarketRegime}.
 *
 * <p>Evaluation order, first match wins:
 * <ol>
 *   <li>not calibrated: CALIBRATING, state untouched</li>
 *   <li>CRASH: any single crash threshold, or any enabled compound pair</li>
 *   <li>RECOVERY entry: previous regime CRASH and spread ratio back below the recovery level</li>
 *   <li>RECOVERY hold: count the cooldown down, NORMAL once it has expired and spreads are tight</li>
 *   <li>STRESSED: stay thresholds if already stressed, enter thresholds otherwise</li>
 *   <li>HFT: stable market with churn over the enter (or, if already HFT, the stay) level</li>
 *   <li>NORMAL</li>
 * </ol>
 *
 * <p>Holds no state of its own; all mutation goes to the {@link RegimeState} argument.
 * NaN signals are replaced with neutral values so every call resolves to a regime.
 */
public class RegimeClassifier {

    private final RegimeThresholds thresholds;

    public RegimeClassifier(RegimeThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public MarketRegime classify(MarketMetrics metrics, RegimeState state) {
        if (metrics == null || !metrics.isCalibrated()) {
            return MarketRegime.CALIBRATING;
        }

        double spreadRatio = neutralIfNaN(metrics.getSpreadRatio(), 1.0);
        double depthRatio = neutralIfNaN(metrics.getDepthRatio(), 1.0);
        double momentum = Math.abs(neutralIfNaN(metrics.getMomentum(), 0.0));
        double imbalance = Math.abs(neutralIfNaN(metrics.getImbalance(), 0.0));
        double churn = neutralIfNaN(metrics.getChurn(), 0.0);

        MarketRegime current = state.getCurrentRegime();
        MarketRegime next;

        if (isCrash(spreadRatio, momentum, imbalance)) {
            next = MarketRegime.CRASH;
            state.setCrashCooldown(0);
        } else if (current == MarketRegime.CRASH && spreadRatio < thresholds.getRecovery().getEnterSpreadRatio()) {
            next = MarketRegime.RECOVERY;
            state.setCrashCooldown(thresholds.getRecovery().getCooldownSteps());
        } else if (current == MarketRegime.RECOVERY) {
            int cooldown = state.getCrashCooldown() - 1;
            state.setCrashCooldown(cooldown);
            boolean expired = cooldown <= 0 && spreadRatio < thresholds.getRecovery().getExitSpreadRatio();
            next = expired ? MarketRegime.NORMAL : MarketRegime.RECOVERY;
        } else if (current == MarketRegime.STRESSED) {
            next = staysStressed(spreadRatio, imbalance, depthRatio) ? MarketRegime.STRESSED : MarketRegime.NORMAL;
        } else if (entersStressed(spreadRatio, imbalance, depthRatio)) {
            next = MarketRegime.STRESSED;
        } else if (isHft(spreadRatio, depthRatio, momentum, churn, current == MarketRegime.HFT)) {
            next = MarketRegime.HFT;
        } else {
            next = MarketRegime.NORMAL;
        }

        state.advance(next);
        return next;
    }

    public RegimeThresholds getThresholds() {
        return thresholds;
    }

    private boolean isCrash(double spreadRatio, double momentum, double imbalance) {
        RegimeThresholds.Crash crash = thresholds.getCrash();
        if (spreadRatio > crash.getSpreadRatio()
                || momentum > crash.getMomentum()
                || imbalance > crash.getImbalance()) {
            return true;
        }
        if (!crash.isCompoundEnabled()) {
            return false;
        }
        boolean wideSpread = spreadRatio > crash.getCompoundSpreadRatio();
        return (wideSpread && momentum > crash.getCompoundMomentum())
                || (wideSpread && imbalance > crash.getCompoundImbalance())
                || (momentum > crash.getPairedMomentum() && imbalance > crash.getPairedImbalance());
    }

    private boolean entersStressed(double spreadRatio, double imbalance, double depthRatio) {
        RegimeThresholds.Stressed stressed = thresholds.getStressed();
        return spreadRatio > stressed.getEnterSpreadRatio()
                || imbalance > stressed.getEnterImbalance()
                || depthRatio < stressed.getEnterDepthRatio();
    }

    private boolean staysStressed(double spreadRatio, double imbalance, double depthRatio) {
        RegimeThresholds.Stressed stressed = thresholds.getStressed();
        return spreadRatio > stressed.getStaySpreadRatio()
                || imbalance > stressed.getStayImbalance()
                || depthRatio < stressed.getStayDepthRatio();
    }

    private boolean isHft(double spreadRatio, double depthRatio, double momentum, double churn, boolean alreadyHft) {
        RegimeThresholds.Hft hft = thresholds.getHft();
        boolean stable = spreadRatio < hft.getMaxSpreadRatio()
                && depthRatio > hft.getMinDepthRatio()
                && momentum < hft.getMaxMomentum();
        double requiredChurn = alreadyHft ? hft.getStayChurn() : hft.getEnterChurn();
        return stable && churn >= requiredChurn;
    }

    private static double neutralIfNaN(double value, double fallback) {
        return Double.isNaN(value) ? fallback : value;
    }
}
