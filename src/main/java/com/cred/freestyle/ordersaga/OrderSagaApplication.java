package com.cred.freestyle.ordersaga;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the order saga participants.
 *
 * Hosts the two choreography participants of the order-fulfillment saga:
 * - Inventory: reserves stock on order.created, commits on payment.completed,
 *   releases on order.canceled (and on reservation expiry)
 * - Fulfillment: prepares a shipment on tax.calculated, buys a label on
 *   payment.completed, cancels the shipment on order.canceled
 *
 * Architecture:
 * - Messaging: Kafka listener routes upstream events to participant handlers
 * - Service Layer: participant logic built on conditional (CAS) transitions
 * - Data Access Layer: JPA repositories for reservations and shipments
 * - Infrastructure Layer: Redis processed-event cache, shipping provider, metrics
 *
 * @author Order Saga Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
public class OrderSagaApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderSagaApplication.class, args);
    }
}
