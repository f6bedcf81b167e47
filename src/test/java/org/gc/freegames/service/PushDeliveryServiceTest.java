package org.gc.freegames.service;

import org.gc.freegames.clients.DeliveryException;
import org.gc.freegames.clients.DeliveryTransport;
import org.gc.freegames.domain.ContentItem;
import org.gc.freegames.domain.DeliveryOutcome;
import org.gc.freegames.domain.DeliveryPayload;
import org.gc.freegames.domain.Subscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PushDeliveryServiceTest {

    private static final String JOB_ID = "epic_group_42";
    private static final Subscriber SUBSCRIBER = Subscriber.channel("42");
    private static final DeliveryPayload PAYLOAD = DeliveryPayload.of(ContentItem.text("2 game(s) free right now!"));

    @Mock
    private SubscriptionService subscriptionService;
    @Mock
    private ContentProvider contentProvider;
    @Mock
    private ContentFingerprintService fingerprintService;
    @Mock
    private DeliveryTransport deliveryTransport;

    private PushDeliveryService deliveryService;

    @BeforeEach
    void setUp() {
        deliveryService = new PushDeliveryService(subscriptionService, contentProvider, fingerprintService,
                deliveryTransport);
    }

    @Test
    void unsubscribedTargetIsReportedAsOrphaned() {
        when(subscriptionService.isSubscribed(SUBSCRIBER)).thenReturn(false);

        StepVerifier.create(deliveryService.executeDelivery(JOB_ID, SUBSCRIBER))
                .expectNext(DeliveryOutcome.ORPHANED)
                .verifyComplete();

        verifyNoInteractions(contentProvider, fingerprintService, deliveryTransport);
    }

    @Test
    void unchangedContentIsNotSent() {
        when(subscriptionService.isSubscribed(SUBSCRIBER)).thenReturn(true);
        when(contentProvider.fetchContent()).thenReturn(Mono.just(PAYLOAD));
        when(fingerprintService.shouldDeliver(JOB_ID, PAYLOAD)).thenReturn(false);

        StepVerifier.create(deliveryService.executeDelivery(JOB_ID, SUBSCRIBER))
                .expectNext(DeliveryOutcome.SKIPPED_UNCHANGED)
                .verifyComplete();

        verify(deliveryTransport, never()).send(any(), any());
    }

    @Test
    void newContentIsSent() {
        when(subscriptionService.isSubscribed(SUBSCRIBER)).thenReturn(true);
        when(contentProvider.fetchContent()).thenReturn(Mono.just(PAYLOAD));
        when(fingerprintService.shouldDeliver(JOB_ID, PAYLOAD)).thenReturn(true);
        when(deliveryTransport.send(SUBSCRIBER, PAYLOAD)).thenReturn(Mono.empty());

        StepVerifier.create(deliveryService.executeDelivery(JOB_ID, SUBSCRIBER))
                .expectNext(DeliveryOutcome.DELIVERED)
                .verifyComplete();

        verify(deliveryTransport).send(SUBSCRIBER, PAYLOAD);
    }

    @Test
    void transportFailureIsContainedAndFingerprintKept() {
        when(subscriptionService.isSubscribed(SUBSCRIBER)).thenReturn(true);
        when(contentProvider.fetchContent()).thenReturn(Mono.just(PAYLOAD));
        when(fingerprintService.shouldDeliver(JOB_ID, PAYLOAD)).thenReturn(true);
        when(deliveryTransport.send(SUBSCRIBER, PAYLOAD))
                .thenReturn(Mono.error(new DeliveryException("bot offline")));

        StepVerifier.create(deliveryService.executeDelivery(JOB_ID, SUBSCRIBER))
                .expectNext(DeliveryOutcome.TRANSPORT_FAILED)
                .verifyComplete();

        verify(fingerprintService).shouldDeliver(JOB_ID, PAYLOAD);
    }

    @Test
    void membershipIsCheckedAtSubscriptionTime() {
        Mono<DeliveryOutcome> pending = deliveryService.executeDelivery(JOB_ID, SUBSCRIBER);

        verifyNoInteractions(subscriptionService);

        when(subscriptionService.isSubscribed(SUBSCRIBER)).thenReturn(false);
        StepVerifier.create(pending).expectNext(DeliveryOutcome.ORPHANED).verifyComplete();
    }

    @Test
    void deliverNowBypassesMembershipAndHistory() {
        when(contentProvider.fetchContent()).thenReturn(Mono.just(PAYLOAD));
        when(deliveryTransport.send(SUBSCRIBER, PAYLOAD)).thenReturn(Mono.empty());

        StepVerifier.create(deliveryService.deliverNow(SUBSCRIBER)).verifyComplete();

        verifyNoInteractions(subscriptionService, fingerprintService);
    }

    @Test
    void deliverNowPropagatesTransportFailure() {
        when(contentProvider.fetchContent()).thenReturn(Mono.just(PAYLOAD));
        when(deliveryTransport.send(SUBSCRIBER, PAYLOAD))
                .thenReturn(Mono.error(new DeliveryException("bot offline")));

        StepVerifier.create(deliveryService.deliverNow(SUBSCRIBER))
                .expectError(DeliveryException.class)
                .verify();
    }
}
