package com.regimetrader.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * One market update received from the exchange for a single simulation step.
 *
 * <p>Derived fields (mid, spread, depths) are computed once by {@link #of} so every consumer
 * sees the same values. When the message carries no book levels the snapshot degrades to a
 * single level per side at best bid/ask with zero quantity.
 */
@Data
@Builder
public class MarketSnapshot {

    private long step;
    private double bid;
    private double ask;
    private double mid;
    private double spread;
    private double lastTrade;
    private int bidDepth;
    private int askDepth;
    private List<BookLevel> bids;
    private List<BookLevel> asks;

    /**
     * Builds a snapshot from raw quote fields, deriving mid, spread and aggregate depth.
     *
     * @param bids bid levels best first, may be null or empty
     * @param asks ask levels best first, may be null or empty
     */
    public static MarketSnapshot of(
            long step, double bid, double ask, double lastTrade, List<BookLevel> bids, List<BookLevel> asks) {
        List<BookLevel> bidLevels = levelsOrFallback(bids, bid);
        List<BookLevel> askLevels = levelsOrFallback(asks, ask);

        return MarketSnapshot.builder()
                .step(step)
                .bid(bid)
                .ask(ask)
                .mid(midOf(bid, ask))
                .spread(bid > 0 && ask > 0 ? ask - bid : 0.0)
                .lastTrade(lastTrade)
                .bidDepth(totalQuantity(bidLevels))
                .askDepth(totalQuantity(askLevels))
                .bids(bidLevels)
                .asks(askLevels)
                .build();
    }

    /** mid = (bid+ask)/2 when both sides are present, else whichever side is nonzero, else 0. */
    public static double midOf(double bid, double ask) {
        if (bid > 0 && ask > 0) {
            return (bid + ask) / 2.0;
        }
        if (bid > 0) {
            return bid;
        }
        return Math.max(ask, 0.0);
    }

    /** True when best bid, best ask and mid are all strictly positive. */
    public boolean isQuoteValid() {
        return bid > 0 && ask > 0 && mid > 0;
    }

    private static List<BookLevel> levelsOrFallback(List<BookLevel> levels, double bestPrice) {
        if (levels == null || levels.isEmpty()) {
            return List.of(BookLevel.builder().price(bestPrice).quantity(0).build());
        }
        return List.copyOf(levels);
    }

    private static int totalQuantity(List<BookLevel> levels) {
        int total = 0;
        for (BookLevel level : levels) {
            total += level.getQuantity();
        }
        return total;
    }
}
