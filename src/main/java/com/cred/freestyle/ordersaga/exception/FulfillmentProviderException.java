package com.cred.freestyle.ordersaga.exception;

/**
 * Exception thrown when the shipping provider cannot create a label.
 *
 * @author Order Saga Team
 */
public class FulfillmentProviderException extends RuntimeException {

    private final String shipmentId;

    public FulfillmentProviderException(String shipmentId, String message) {
        super(String.format("Shipping provider failed for shipment %s: %s", shipmentId, message));
        this.shipmentId = shipmentId;
    }

    public FulfillmentProviderException(String shipmentId, String message, Throwable cause) {
        super(String.format("Shipping provider failed for shipment %s: %s", shipmentId, message), cause);
        this.shipmentId = shipmentId;
    }

    public String getShipmentId() {
        return shipmentId;
    }
}
