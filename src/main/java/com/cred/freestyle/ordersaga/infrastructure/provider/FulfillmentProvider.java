package com.cred.freestyle.ordersaga.infrastructure.provider;

import com.cred.freestyle.ordersaga.domain.model.Shipment;
import com.cred.freestyle.ordersaga.exception.FulfillmentProviderException;

/**
 * External shipping provider (carrier aggregator).
 *
 * @author Order Saga Team
 */
public interface FulfillmentProvider {

    /**
     * Buy a shipping label for a prepared shipment.
     *
     * @param shipment Shipment in CREATED status
     * @return carrier, tracking number, label URL and estimated delivery
     * @throws FulfillmentProviderException if the provider rejects or cannot be reached
     */
    ShippingLabel createShipment(Shipment shipment);
}
