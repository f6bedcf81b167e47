package org.gc.freegames.clients;

import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.domain.ContentItem;
import org.gc.freegames.domain.ContentType;
import org.gc.freegames.domain.DeliveryPayload;
import org.gc.freegames.domain.Subscriber;
import org.gc.freegames.domain.SubscriberType;
import org.gc.freegames.properties.FreeGamesProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Delivers payloads as merged forward messages through a OneBot v11 HTTP endpoint.
 */
@Slf4j
@Component
public class OneBotDeliveryTransport implements DeliveryTransport {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final FreeGamesProperties.Transport transport;

    public OneBotDeliveryTransport(@Qualifier("oneBotWebClient") WebClient webClient, FreeGamesProperties properties) {
        this.webClient = webClient;
        this.transport = properties.getTransport();
    }

    @Override
    public Mono<Void> send(Subscriber subscriber, DeliveryPayload payload) {
        boolean channel = subscriber.getType() == SubscriberType.CHANNEL;
        String action = channel ? "/send_group_forward_msg" : "/send_private_forward_msg";

        Map<String, Object> body = new LinkedHashMap<>();
        body.put(channel ? "group_id" : "user_id", subscriber.getSubjectId());
        body.put("messages", forwardNodes(payload));

        return webClient.post()
                .uri(action)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(RESPONSE_TYPE)
                .timeout(transport.getTimeout())
                .flatMap(response -> {
                    Object status = response.get("status");
                    if ("ok".equals(status) || "async".equals(status)) {
                        return Mono.<Void>empty();
                    }
                    return Mono.<Void>error(new DeliveryException(
                            action + " rejected for " + subscriber + ": " + response.get("message")));
                })
                .doOnSuccess(v -> log.debug("{} accepted for {}", action, subscriber));
    }

    List<Map<String, Object>> forwardNodes(DeliveryPayload payload) {
        return payload.getItems().stream()
                .map(this::forwardNode)
                .collect(Collectors.toList());
    }

    private Map<String, Object> forwardNode(ContentItem item) {
        Map<String, Object> segment = item.getType() == ContentType.IMAGE
                ? Map.of("type", "image", "data", Map.of("file", item.getValue()))
                : Map.of("type", "text", "data", Map.of("text", item.getValue()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("nickname", transport.getNickname());
        data.put("user_id", transport.getSenderId());
        data.put("content", List.of(segment));

        return Map.of("type", "node", "data", data);
    }
}
