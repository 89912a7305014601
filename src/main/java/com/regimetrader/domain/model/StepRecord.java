package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.MarketRegime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything that happened during one decision step, handed to logging and reporting
 * collaborators. The collaborator owns the persistence format.
 */
@Value
@Builder
public class StepRecord {

    long step;
    MarketSnapshot market;
    PositionSnapshot position;
    MarketRegime regime;

    /** Strategy selected by the router, null when no strategy ran. */
    String strategyName;

    /** Order actually sent this step, null if none. */
    OrderRecord action;

    /** Fills received since the previous step, oldest first. */
    @Builder.Default
    List<Fill> fills = List.of();
}
