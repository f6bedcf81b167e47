package org.gc.freegames.controller;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.domain.DeliveryJob;
import org.gc.freegames.domain.Subscriber;
import org.gc.freegames.domain.SubscriberType;
import org.gc.freegames.domain.SubscriptionResult;
import org.gc.freegames.domain.dto.StatusResponse;
import org.gc.freegames.domain.dto.SubscribeRequest;
import org.gc.freegames.properties.FreeGamesProperties;
import org.gc.freegames.repository.JobScheduleRepository;
import org.gc.freegames.service.JobIds;
import org.gc.freegames.service.PushDeliveryService;
import org.gc.freegames.service.PushJobScheduler;
import org.gc.freegames.service.SubscriptionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/free-games")
public class FreeGamesController {

    private final SubscriptionService subscriptionService;
    private final PushJobScheduler pushJobScheduler;
    private final PushDeliveryService pushDeliveryService;
    private final JobScheduleRepository jobScheduleRepository;
    private final JobIds jobIds;
    private final FreeGamesProperties properties;
    private final Clock clock;
    private final Instant startedAt;

    public FreeGamesController(SubscriptionService subscriptionService,
                               PushJobScheduler pushJobScheduler,
                               PushDeliveryService pushDeliveryService,
                               JobScheduleRepository jobScheduleRepository,
                               JobIds jobIds,
                               FreeGamesProperties properties,
                               Clock clock) {
        this.subscriptionService = subscriptionService;
        this.pushJobScheduler = pushJobScheduler;
        this.pushDeliveryService = pushDeliveryService;
        this.jobScheduleRepository = jobScheduleRepository;
        this.jobIds = jobIds;
        this.properties = properties;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<StatusResponse>> status() {
        Duration uptime = Duration.between(startedAt, clock.instant());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("uptime_seconds", uptime.getSeconds());
        details.put("active_jobs", pushJobScheduler.activeJobCount());
        details.put("reference_zone", properties.getScheduler().getReferenceZone());
        return Mono.just(ResponseEntity.ok(StatusResponse.builder()
                .message("Free games push is running.")
                .details(details)
                .build()));
    }

    /**
     * Lists every subscriber together with the persisted schedule.
     */
    @GetMapping("/subscriptions")
    public Mono<ResponseEntity<Map<String, Object>>> listSubscriptions() {
        return Mono.fromCallable(() -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("subscriptions", subscriptionService.listAll());
            body.put("scheduler", jobScheduleRepository.load());
            return ResponseEntity.ok(body);
        });
    }

    /**
     * Subscribes a channel or direct recipient and schedules its daily push.
     *
     * Example:
     * POST /free-games/subscriptions
     * {
     *   "type": "channel",
     *   "subjectId": "123456",
     *   "time": "8:30"
     * }
     */
    @PostMapping("/subscriptions")
    public Mono<ResponseEntity<StatusResponse>> subscribe(@Valid @RequestBody SubscribeRequest request) {
        Subscriber subscriber = new Subscriber(request.getType(), request.getSubjectId());
        log.info("Received subscribe request for {} at {}", subscriber, request.getTime());

        String[] timeParts = request.getTime().split(":");
        int hour = Integer.parseInt(timeParts[0]);
        int minute = Integer.parseInt(timeParts[1]);
        if (hour > 23 || minute > 59) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(StatusResponse.of("Delivery time must be a valid HH:MM time, e.g. 8:30")));
        }

        return Mono.fromCallable(() -> {
                    SubscriptionResult result = subscriptionService.subscribe(subscriber);
                    if (result == SubscriptionResult.WRITE_FAILED) {
                        return ResponseEntity.internalServerError()
                                .body(StatusResponse.of("Failed to save subscription for " + subscriber));
                    }
                    DeliveryJob job = pushJobScheduler.addJob(jobIds.of(subscriber), hour, minute, subscriber);
                    return ResponseEntity.ok(StatusResponse.builder()
                            .message("Daily push enabled for " + subscriber + " at " + job.displayTime())
                            .subscriber(subscriber.toString())
                            .jobId(job.getId())
                            .time(job.displayTime())
                            .subscribed(true)
                            .result(result)
                            .build());
                })
                .onErrorResume(error -> {
                    log.error("Error subscribing {}: {}", subscriber, error.getMessage());
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(StatusResponse.of("Failed to subscribe: " + error.getMessage())));
                });
    }

    @DeleteMapping("/subscriptions/{type}/{subjectId}")
    public Mono<ResponseEntity<StatusResponse>> unsubscribe(@PathVariable String type, @PathVariable String subjectId) {
        return subscriber(type, subjectId)
                .map(subscriber -> Mono.fromCallable(() -> {
                    SubscriptionResult result = subscriptionService.unsubscribe(subscriber);
                    if (result == SubscriptionResult.WRITE_FAILED) {
                        return ResponseEntity.internalServerError()
                                .body(StatusResponse.of("Failed to save unsubscription for " + subscriber));
                    }
                    pushJobScheduler.removeJob(jobIds.of(subscriber));
                    return ResponseEntity.ok(StatusResponse.builder()
                            .message("Daily push cancelled for " + subscriber)
                            .subscriber(subscriber.toString())
                            .subscribed(false)
                            .result(result)
                            .build());
                }))
                .orElseGet(() -> Mono.just(unknownType(type)));
    }

    @GetMapping("/subscriptions/{type}/{subjectId}")
    public Mono<ResponseEntity<StatusResponse>> subscriptionStatus(@PathVariable String type,
                                                                   @PathVariable String subjectId) {
        return subscriber(type, subjectId)
                .map(subscriber -> Mono.fromCallable(() -> {
                    StatusResponse.StatusResponseBuilder response = StatusResponse.builder()
                            .subscriber(subscriber.toString());
                    if (!subscriptionService.isSubscribed(subscriber)) {
                        return ResponseEntity.ok(response
                                .message(subscriber + " is not subscribed")
                                .subscribed(false)
                                .build());
                    }
                    String jobId = jobIds.of(subscriber);
                    String scheduled = jobScheduleRepository.load().get(jobId);
                    if (scheduled == null) {
                        return ResponseEntity.ok(response
                                .message(subscriber + " is subscribed but has no delivery time, unsubscribe and subscribe again")
                                .subscribed(true)
                                .build());
                    }
                    String display = DeliveryJob.fromScheduleValue(jobId, scheduled, subscriber).displayTime();
                    return ResponseEntity.ok(response
                            .message(subscriber + " receives a daily push at " + display)
                            .subscribed(true)
                            .jobId(jobId)
                            .time(display)
                            .build());
                }))
                .orElseGet(() -> Mono.just(unknownType(type)));
    }

    /**
     * Pushes the current free games to a subscriber immediately, bypassing the push history.
     */
    @PostMapping("/deliveries/{type}/{subjectId}")
    public Mono<ResponseEntity<StatusResponse>> deliverNow(@PathVariable String type, @PathVariable String subjectId) {
        return subscriber(type, subjectId)
                .map(subscriber -> pushDeliveryService.deliverNow(subscriber)
                        .then(Mono.fromCallable(() -> ResponseEntity.ok(
                                StatusResponse.of("Free games pushed to " + subscriber))))
                        .onErrorResume(error -> Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                                .body(StatusResponse.of("Free games query failed, please try again later: "
                                        + error.getMessage())))))
                .orElseGet(() -> Mono.just(unknownType(type)));
    }

    private static Optional<Subscriber> subscriber(String type, String subjectId) {
        return SubscriberType.fromToken(type).map(subscriberType -> new Subscriber(subscriberType, subjectId));
    }

    private static ResponseEntity<StatusResponse> unknownType(String type) {
        return ResponseEntity.badRequest().body(StatusResponse.of("Unknown subscriber type: " + type));
    }
}
