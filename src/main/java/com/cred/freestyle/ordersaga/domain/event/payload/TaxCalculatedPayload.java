package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * tax.calculated (v1). The tax service forwards the order lines and the
 * shipping address it was given inside metadata; older producers send
 * them at the top level.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaxCalculatedPayload(
        @NotBlank(message = "order_id is required") String orderId,
        String userId,
        BigDecimal taxAmount,
        Map<String, Object> shippingAddress,
        List<LineItemPayload> items,
        Metadata metadata
) {

    public List<LineItemPayload> resolvedItems() {
        if (metadata != null && metadata.items() != null) {
            return metadata.items();
        }
        return items == null ? Collections.emptyList() : items;
    }

    public Map<String, Object> resolvedShippingAddress() {
        if (shippingAddress != null) {
            return shippingAddress;
        }
        if (metadata != null && metadata.shippingAddress() != null) {
            return metadata.shippingAddress();
        }
        return Collections.emptyMap();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
            List<LineItemPayload> items,
            Map<String, Object> shippingAddress
    ) {
    }
}
