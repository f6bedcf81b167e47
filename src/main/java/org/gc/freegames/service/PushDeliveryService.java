package org.gc.freegames.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.clients.DeliveryTransport;
import org.gc.freegames.domain.DeliveryOutcome;
import org.gc.freegames.domain.Subscriber;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class PushDeliveryService {

    private final SubscriptionService subscriptionService;
    private final ContentProvider contentProvider;
    private final ContentFingerprintService fingerprintService;
    private final DeliveryTransport deliveryTransport;

    /**
     * Runs one scheduled delivery for a job.
     * <p>
     * Membership is re-checked first; a subscriber that left out of band yields
     * {@link DeliveryOutcome#ORPHANED} without fetching anything. Unchanged content yields
     * {@link DeliveryOutcome#SKIPPED_UNCHANGED}. A transport failure is logged and reported as
     * {@link DeliveryOutcome#TRANSPORT_FAILED}; the fingerprint recorded before the send is kept.
     */
    public Mono<DeliveryOutcome> executeDelivery(String jobId, Subscriber subscriber) {
        return Mono.defer(() -> {
            log.info("Starting push job {}", jobId);

            if (!subscriptionService.isSubscribed(subscriber)) {
                log.warn("Job {} targets {} which is no longer subscribed, removing it", jobId, subscriber);
                return Mono.just(DeliveryOutcome.ORPHANED);
            }

            return contentProvider.fetchContent()
                    .flatMap(payload -> {
                        if (!fingerprintService.shouldDeliver(jobId, payload)) {
                            log.info("Job {}: content unchanged, skipping push", jobId);
                            return Mono.just(DeliveryOutcome.SKIPPED_UNCHANGED);
                        }
                        return deliveryTransport.send(subscriber, payload)
                                .thenReturn(DeliveryOutcome.DELIVERED)
                                .doOnSuccess(outcome -> log.info("Push job {} delivered to {}", jobId, subscriber))
                                .onErrorResume(error -> {
                                    log.error("Push job {} failed to deliver to {}: {}",
                                            jobId, subscriber, error.getMessage(), error);
                                    return Mono.just(DeliveryOutcome.TRANSPORT_FAILED);
                                });
                    });
        });
    }

    /**
     * On-demand push for manual queries. Ignores the push history and propagates transport errors.
     */
    public Mono<Void> deliverNow(Subscriber subscriber) {
        return contentProvider.fetchContent()
                .flatMap(payload -> deliveryTransport.send(subscriber, payload))
                .doOnSuccess(v -> log.info("Manual push delivered to {}", subscriber))
                .doOnError(error -> log.error("Manual push to {} failed: {}", subscriber, error.getMessage()));
    }
}
