package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * Order line as sent by upstream services. Upstream payloads identify the
 * product by sku_id, product_id or id depending on the producer.
 *
 * @author Order Saga Team
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LineItemPayload(
        String skuId,
        String productId,
        String id,
        Integer quantity,
        BigDecimal unitPrice,
        Integer weightGrams
) {

    /**
     * First non-blank of sku_id, product_id and id; null when none is present.
     */
    public String resolvedSku() {
        if (skuId != null && !skuId.isBlank()) {
            return skuId;
        }
        if (productId != null && !productId.isBlank()) {
            return productId;
        }
        if (id != null && !id.isBlank()) {
            return id;
        }
        return null;
    }

    /**
     * Quantity, defaulting to 1 when missing or not positive.
     */
    public int resolvedQuantity() {
        return quantity == null || quantity <= 0 ? 1 : quantity;
    }
}
