package com.regimetrader.oms;

import com.regimetrader.domain.model.OrderRecord;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Result of submitting a candidate through the {@link OrderLifecycleManager}.
 *
 * <p>{@code cancelledOrderIds} lists every cancel issued while handling the submission:
 * self-cross cancels and, for DEFERRED, capacity evictions.
 */
@Data
@Builder
public class SubmitResult {

    private SubmitStatus status;

    /** The order as sent. Null when DEFERRED. */
    private OrderRecord order;

    @Builder.Default
    private List<String> cancelledOrderIds = List.of();

    /** Why the order was not sent. Null if accepted. */
    private String reason;

    public static SubmitResult accepted(OrderRecord order, List<String> cancelledOrderIds) {
        return SubmitResult.builder()
                .status(SubmitStatus.ACCEPTED)
                .order(order)
                .cancelledOrderIds(List.copyOf(cancelledOrderIds))
                .build();
    }

    public static SubmitResult deferred(List<String> cancelledOrderIds, String reason) {
        return SubmitResult.builder()
                .status(SubmitStatus.DEFERRED)
                .cancelledOrderIds(List.copyOf(cancelledOrderIds))
                .reason(reason)
                .build();
    }

    public static SubmitResult rejected(OrderRecord order, List<String> cancelledOrderIds, String reason) {
        return SubmitResult.builder()
                .status(SubmitStatus.REJECTED)
                .order(order)
                .cancelledOrderIds(List.copyOf(cancelledOrderIds))
                .reason(reason)
                .build();
    }

    public boolean isAccepted() {
        return status == SubmitStatus.ACCEPTED;
    }
}
