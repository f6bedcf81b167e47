package org.gc.freegames.service;

import org.gc.freegames.domain.DeliveryPayload;
import reactor.core.publisher.Mono;

/**
 * Source of the payload pushed to subscribers. Implementations complete with a placeholder
 * payload rather than an error when upstream data is unavailable.
 */
public interface ContentProvider {

    Mono<DeliveryPayload> fetchContent();
}
