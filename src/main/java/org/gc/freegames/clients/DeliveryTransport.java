package org.gc.freegames.clients;

import org.gc.freegames.domain.DeliveryPayload;
import org.gc.freegames.domain.Subscriber;
import reactor.core.publisher.Mono;

/**
 * Sends a rendered payload to a subscriber. Failures are signalled as errors on the returned Mono.
 */
public interface DeliveryTransport {

    Mono<Void> send(Subscriber subscriber, DeliveryPayload payload);
}
