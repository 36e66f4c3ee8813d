package com.cred.freestyle.ordersaga.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores free-form maps (metadata, shipping address) as JSON.
 */
@Converter
public class JsonMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(new TypeReference<Map<String, Object>>() {});
    }

    @Override
    protected Map<String, Object> emptyValue() {
        return new LinkedHashMap<>();
    }
}
