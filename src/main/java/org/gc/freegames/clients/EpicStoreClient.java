package org.gc.freegames.clients;

import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.domain.epic.EpicGame;
import org.gc.freegames.domain.epic.EpicPromotionsResponse;
import org.gc.freegames.properties.FreeGamesProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Component
public class EpicStoreClient {

    private final WebClient webClient;
    private final FreeGamesProperties.Provider provider;

    public EpicStoreClient(@Qualifier("epicStoreWebClient") WebClient webClient, FreeGamesProperties properties) {
        this.webClient = webClient;
        this.provider = properties.getProvider();
    }

    /**
     * Queries the current store promotions. Never errors: HTTP failures, timeouts and
     * unreadable bodies all complete with an empty list.
     */
    public Mono<List<EpicGame>> fetchPromotions() {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(provider.getPath())
                        .queryParam("locale", provider.getLocale())
                        .queryParam("country", provider.getCountry())
                        .queryParam("allowCountries", provider.getCountry())
                        .build())
                .retrieve()
                .bodyToMono(EpicPromotionsResponse.class)
                .map(EpicPromotionsResponse::elements)
                .timeout(provider.getTimeout())
                .defaultIfEmpty(List.of())
                .doOnSuccess(games -> log.debug("Store returned {} promotion entries", games.size()))
                .onErrorResume(error -> {
                    log.error("Error querying store promotions: {}", error.getMessage());
                    return Mono.just(List.of());
                });
    }
}
