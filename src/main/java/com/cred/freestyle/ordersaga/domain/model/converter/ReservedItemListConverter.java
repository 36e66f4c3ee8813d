package com.cred.freestyle.ordersaga.domain.model.converter;

import com.cred.freestyle.ordersaga.domain.model.ReservedItem;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class ReservedItemListConverter extends JsonAttributeConverter<List<ReservedItem>> {

    public ReservedItemListConverter() {
        super(new TypeReference<List<ReservedItem>>() {});
    }

    @Override
    protected List<ReservedItem> emptyValue() {
        return new ArrayList<>();
    }
}
