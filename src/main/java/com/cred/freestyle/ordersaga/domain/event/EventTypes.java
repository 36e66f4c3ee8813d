package com.cred.freestyle.ordersaga.domain.event;

/**
 * Event type and source names used on the bus.
 *
 * @author Order Saga Team
 */
public final class EventTypes {

    private EventTypes() {
    }

    // Upstream services
    public static final String ORDER_SERVICE = "order_service";
    public static final String PAYMENT_SERVICE = "payment_service";
    public static final String TAX_SERVICE = "tax_service";

    // Consumed
    public static final String ORDER_CREATED = "order.created";
    public static final String ORDER_CANCELED = "order.canceled";
    public static final String PAYMENT_COMPLETED = "payment.completed";
    public static final String TAX_CALCULATED = "tax.calculated";

    // Published by inventory
    public static final String INVENTORY_RESERVED = "inventory.reserved";
    public static final String INVENTORY_COMMITTED = "inventory.committed";
    public static final String INVENTORY_RELEASED = "inventory.released";
    public static final String INVENTORY_FAILED = "inventory.failed";

    // Published by fulfillment
    public static final String SHIPMENT_PREPARED = "fulfillment.shipment.prepared";
    public static final String LABEL_CREATED = "fulfillment.label.created";
    public static final String SHIPMENT_CANCELED = "fulfillment.shipment.canceled";
    public static final String SHIPMENT_FAILED = "fulfillment.shipment.failed";

    public static String subject(String source, String type) {
        return source + "." + type;
    }
}
