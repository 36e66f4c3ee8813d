package com.cred.freestyle.ordersaga.saga;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static routing table from subject ({@code <source_service>.<event_type>})
 * to the participant handlers that react to it.
 *
 * A handler that throws is isolated: its failure is turned into a retryable
 * FAILED result and the remaining handlers still run.
 *
 * @author Order Saga Team
 */
public class EventRouter {

    private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

    static final String DISPATCH_ERROR = "DISPATCH_ERROR";

    private final Map<String, List<SagaEventHandler>> routes;
    private final SagaMetricsService metricsService;

    private EventRouter(Map<String, List<SagaEventHandler>> routes, SagaMetricsService metricsService) {
        this.routes = routes;
        this.metricsService = metricsService;
    }

    public static Builder builder(SagaMetricsService metricsService) {
        return new Builder(metricsService);
    }

    /**
     * Subjects with at least one handler. Used as the listener's topic list.
     */
    public String[] subscribedSubjects() {
        return routes.keySet().toArray(new String[0]);
    }

    public List<SagaEventHandler> handlersFor(String subject) {
        return routes.getOrDefault(subject, Collections.emptyList());
    }

    /**
     * Dispatch an event using the subject derived from its source and type.
     */
    public DispatchResult dispatch(DomainEvent event) {
        return dispatch(event.getSubject(), event);
    }

    /**
     * Dispatch an event to every handler registered for the subject.
     *
     * @param subject Subject the event arrived on
     * @param event Event to dispatch
     * @return per-participant results, empty when nothing is routed for the subject
     */
    public DispatchResult dispatch(String subject, DomainEvent event) {
        List<SagaEventHandler> handlers = handlersFor(subject);
        if (handlers.isEmpty()) {
            logger.debug("No handler registered for subject {}, event {}", subject, event.getId());
            return new DispatchResult(subject, Collections.emptyMap());
        }

        metricsService.recordEventReceived(subject);

        Map<String, HandlerResult> results = new LinkedHashMap<>();
        for (SagaEventHandler handler : handlers) {
            HandlerResult result;
            try {
                result = handler.handle(event);
            } catch (RuntimeException e) {
                logger.error("Handler {} threw while processing {} (event {})",
                        handler.participant(), subject, event.getId(), e);
                result = HandlerResult.retryableFailure(null, DISPATCH_ERROR, e.getMessage());
            }
            metricsService.recordHandlerOutcome(handler.participant(), event.getType(), result.getOutcome().name());
            results.put(handler.participant(), result);
        }
        return new DispatchResult(subject, results);
    }

    /**
     * Builder for the routing table.
     */
    public static final class Builder {

        private final Map<String, List<SagaEventHandler>> routes = new LinkedHashMap<>();
        private final SagaMetricsService metricsService;

        private Builder(SagaMetricsService metricsService) {
            this.metricsService = metricsService;
        }

        public Builder route(String subject, SagaEventHandler... handlers) {
            List<SagaEventHandler> list = routes.computeIfAbsent(subject, s -> new ArrayList<>());
            Collections.addAll(list, handlers);
            return this;
        }

        public EventRouter build() {
            Map<String, List<SagaEventHandler>> table = new LinkedHashMap<>();
            routes.forEach((subject, handlers) -> table.put(subject, List.copyOf(handlers)));
            return new EventRouter(Collections.unmodifiableMap(table), metricsService);
        }
    }
}
