package com.cred.freestyle.ordersaga.domain.model.converter;

import com.cred.freestyle.ordersaga.domain.model.ShipmentItem;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class ShipmentItemListConverter extends JsonAttributeConverter<List<ShipmentItem>> {

    public ShipmentItemListConverter() {
        super(new TypeReference<List<ShipmentItem>>() {});
    }

    @Override
    protected List<ShipmentItem> emptyValue() {
        return new ArrayList<>();
    }
}
