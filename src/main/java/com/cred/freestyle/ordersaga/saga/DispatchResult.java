package com.cred.freestyle.ordersaga.saga;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Results of every handler an event was routed to, keyed by participant.
 *
 * @author Order Saga Team
 */
public final class DispatchResult {

    private final String subject;
    private final Map<String, HandlerResult> results;

    public DispatchResult(String subject, Map<String, HandlerResult> results) {
        this.subject = subject;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public String getSubject() {
        return subject;
    }

    public Map<String, HandlerResult> getResults() {
        return results;
    }

    public boolean isRouted() {
        return !results.isEmpty();
    }

    public boolean hasFailure() {
        return results.values().stream().anyMatch(HandlerResult::isFailed);
    }

    /**
     * True when at least one handler failed in a way redelivery could fix.
     */
    public boolean requiresRedelivery() {
        return results.values().stream().anyMatch(r -> r.isFailed() && r.isRetryable());
    }

    @Override
    public String toString() {
        return "DispatchResult{subject='" + subject + "', results=" + results + '}';
    }
}
