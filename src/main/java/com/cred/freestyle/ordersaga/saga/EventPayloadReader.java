package com.cred.freestyle.ordersaga.saga;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.exception.EventValidationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps an event's loosely typed data onto its payload record and validates it.
 *
 * @author Order Saga Team
 */
@Component
public class EventPayloadReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public EventPayloadReader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.validator = validator;
    }

    /**
     * Read and validate the payload of an event.
     *
     * @param event Inbound event
     * @param payloadType Payload record type
     * @return validated payload
     * @throws EventValidationException if the data cannot be mapped or violates a constraint
     */
    public <T> T read(DomainEvent event, Class<T> payloadType) {
        T payload;
        try {
            payload = objectMapper.convertValue(event.getData(), payloadType);
        } catch (IllegalArgumentException e) {
            throw new EventValidationException(event.getType(), e.getMessage(), e);
        }

        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.joining(", "));
            throw new EventValidationException(event.getType(), message);
        }
        return payload;
    }
}
