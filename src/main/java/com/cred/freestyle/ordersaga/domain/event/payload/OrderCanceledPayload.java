package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * order.canceled (v1).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderCanceledPayload(
        @NotBlank(message = "order_id is required") String orderId,
        String userId,
        String cancellationReason,
        String reason
) {

    public static final String DEFAULT_REASON = "order_canceled";

    /**
     * cancellation_reason, then reason, then {@value #DEFAULT_REASON}.
     */
    public String effectiveReason() {
        if (cancellationReason != null && !cancellationReason.isBlank()) {
            return cancellationReason;
        }
        if (reason != null && !reason.isBlank()) {
            return reason;
        }
        return DEFAULT_REASON;
    }
}
