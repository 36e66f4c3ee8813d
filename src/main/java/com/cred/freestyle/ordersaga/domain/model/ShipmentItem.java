package com.cred.freestyle.ordersaga.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of a shipment's package contents.
 *
 * @author Order Saga Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ShipmentItem {

    /**
     * SKU used when a shipment is prepared without any item lines.
     */
    public static final String PLACEHOLDER_SKU = "placeholder";

    private String skuId;

    private int quantity;

    /**
     * Weight of the whole line (unit weight times quantity).
     */
    private int weightGrams;

    public static ShipmentItem placeholder(int unitWeightGrams) {
        return new ShipmentItem(PLACEHOLDER_SKU, 1, unitWeightGrams);
    }
}
