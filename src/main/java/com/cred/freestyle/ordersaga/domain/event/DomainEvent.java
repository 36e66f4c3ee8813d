package com.cred.freestyle.ordersaga.domain.event;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope exchanged between saga participants.
 *
 * Wire format (JSON):
 * <pre>
 * {"id": "...", "type": "order.created", "source": "order_service",
 *  "timestamp": "2024-01-01T00:00:00Z", "data": {"order_id": "...", ...}}
 * </pre>
 * The routing subject of an event is {@code <source>.<type>}.
 *
 * @author Order Saga Team
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DomainEvent {

    private final String id;
    private final String type;
    private final String source;
    private final Instant timestamp;
    private final Map<String, Object> data;

    @JsonCreator
    public DomainEvent(
            @JsonProperty("id") String id,
            @JsonProperty("type") @JsonAlias("event_type") String type,
            @JsonProperty("source") String source,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("data") Map<String, Object> data) {
        this.id = id;
        this.type = type;
        this.source = source;
        this.timestamp = timestamp;
        this.data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * New event with a fresh id and the current timestamp.
     */
    public static DomainEvent of(String type, String source, Map<String, Object> data) {
        return new DomainEvent(UUID.randomUUID().toString(), type, source, Instant.now(), data);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getData() {
        return data;
    }

    @JsonIgnore
    public String getSubject() {
        return source + "." + type;
    }

    /**
     * Order id carried in the payload, used as the message key.
     */
    @JsonIgnore
    public String getOrderId() {
        Object orderId = data.get("order_id");
        return orderId == null ? null : orderId.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainEvent)) return false;
        DomainEvent that = (DomainEvent) o;
        return Objects.equals(id, that.id)
                && Objects.equals(type, that.type)
                && Objects.equals(source, that.source)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, source, timestamp, data);
    }

    @Override
    public String toString() {
        return "DomainEvent{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", source='" + source + '\'' +
                ", timestamp=" + timestamp +
                ", data=" + data +
                '}';
    }
}
