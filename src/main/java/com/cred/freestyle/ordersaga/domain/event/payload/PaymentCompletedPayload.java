package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

/**
 * payment.completed (v1).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentCompletedPayload(
        @NotBlank(message = "order_id is required") String orderId,
        String userId,
        String paymentId,
        BigDecimal amount
) {
}
