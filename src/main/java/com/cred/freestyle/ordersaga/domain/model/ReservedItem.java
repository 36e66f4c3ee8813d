package com.cred.freestyle.ordersaga.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One line of a reservation's item snapshot.
 *
 * @author Order Saga Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReservedItem {

    private String skuId;

    private int quantity;

    /**
     * Unit price as sent by the order service, null when it was not provided.
     */
    private BigDecimal unitPrice;
}
