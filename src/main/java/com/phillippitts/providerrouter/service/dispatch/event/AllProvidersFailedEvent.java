package com.phillippitts.providerrouter.service.dispatch.event;

import java.time.Instant;
import java.util.List;

/**
 * Every selected candidate failed for a dispatch.
 *
 * @param capability capability being dispatched
 * @param attempted  labels of the attempted candidates, in order
 * @param at         when the dispatch gave up
 */
public record AllProvidersFailedEvent(String capability, List<String> attempted, Instant at) {

    public AllProvidersFailedEvent {
        attempted = List.copyOf(attempted);
    }
}
