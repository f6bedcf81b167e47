package org.gc.freegames.service;

import org.gc.freegames.clients.EpicStoreClient;
import org.gc.freegames.domain.ContentItem;
import org.gc.freegames.domain.DeliveryPayload;
import org.gc.freegames.domain.epic.EpicGame;
import org.gc.freegames.properties.FreeGamesProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FreeGamesContentProviderTest {

    private EpicStoreClient epicStoreClient;
    private FreeGamesContentProvider contentProvider;

    @BeforeEach
    void setUp() {
        epicStoreClient = mock(EpicStoreClient.class);
        contentProvider = new FreeGamesContentProvider(epicStoreClient, new FreeGamesProperties());
    }

    @Test
    void emptyStoreResponseRendersPlaceholder() {
        when(epicStoreClient.fetchPromotions()).thenReturn(Mono.just(List.of()));

        StepVerifier.create(contentProvider.fetchContent())
                .expectNext(DeliveryPayload.of(ContentItem.text(FreeGamesContentProvider.STORE_UNAVAILABLE)))
                .verifyComplete();
    }

    @Test
    void rendersFreeGameWithImageLinkAndDetails() {
        EpicGame game = freeGame("Space Trader")
                .keyImages(List.of(
                        new EpicGame.KeyImage("Logo", "https://cdn.example/logo.png"),
                        new EpicGame.KeyImage("OfferImageWide", "https://cdn.example/wide.png"),
                        new EpicGame.KeyImage("Thumbnail", "https://cdn.example/thumb.png")))
                .customAttributes(List.of(
                        new EpicGame.CustomAttribute("developerName", "Tiny Studio"),
                        new EpicGame.CustomAttribute("publisherName", "Big Publisher")))
                .offerMappings(List.of(
                        new EpicGame.PageMapping("space-trader-addon", "addon"),
                        new EpicGame.PageMapping("space-trader", "productHome")))
                .build();

        DeliveryPayload payload = contentProvider.render(List.of(game));

        assertThat(payload.getItems()).containsExactly(
                ContentItem.text("1 game(s) free right now!"),
                ContentItem.image("https://cdn.example/wide.png"),
                ContentItem.text("https://store.epicgames.com/zh-CN/p/space-trader"),
                ContentItem.text("Space Trader (¥90.00)\n\nTrade among the stars.\n\n"
                        + "Developed by Tiny Studio and published by Big Publisher, "
                        + "free until 5/23 23:00, grab it from the link above!"));
    }

    @Test
    void skipsGamesThatAreNotFreeNow() {
        EpicGame discounted = freeGame("Discounted")
                .price(price("¥90.00", "¥45.00"))
                .build();
        EpicGame upcoming = freeGame("Upcoming")
                .promotions(new EpicGame.Promotions(List.of(), List.of(offers("2024-05-30T15:00:00.000Z"))))
                .build();
        EpicGame noPromotion = freeGame("Plain").promotions(null).build();

        DeliveryPayload payload = contentProvider.render(List.of(discounted, upcoming, noPromotion));

        assertThat(payload.getItems()).containsExactly(ContentItem.text(FreeGamesContentProvider.NO_FREE_GAMES));
    }

    @Test
    void samePublisherAndDeveloperIsMentionedOnce() {
        EpicGame game = freeGame("Solo").seller(new EpicGame.Seller("Solo Games")).build();

        DeliveryPayload payload = contentProvider.render(List.of(game));

        assertThat(last(payload)).contains("Published by Solo Games, free until");
    }

    @Test
    void testPublisherAccountIsOmitted() {
        EpicGame game = freeGame("Mystery").seller(new EpicGame.Seller("Epic Dev Test Account")).build();

        DeliveryPayload payload = contentProvider.render(List.of(game));

        assertThat(last(payload)).contains("Trade among the stars.\n\nfree until 5/23 23:00");
    }

    @Test
    void linkFallsBackThroughSlugSourcesToStoreHome() {
        EpicGame withUrl = freeGame("A").url("https://store.example/a").build();
        EpicGame withCatalogSlug = freeGame("B")
                .catalogNs(new EpicGame.CatalogNs(List.of(new EpicGame.PageMapping("b-slug", "productHome"))))
                .build();
        EpicGame withAttributeSlug = freeGame("C")
                .customAttributes(List.of(new EpicGame.CustomAttribute("com.epicgames.app.productSlug", "c-slug")))
                .build();
        EpicGame bare = freeGame("D").build();

        List<ContentItem> items = contentProvider.render(List.of(withUrl, withCatalogSlug, withAttributeSlug, bare))
                .getItems();

        assertThat(items.get(0)).isEqualTo(ContentItem.text("4 game(s) free right now!"));
        assertThat(items).contains(
                ContentItem.text("https://store.example/a"),
                ContentItem.text("https://store.epicgames.com/zh-CN/p/b-slug"),
                ContentItem.text("https://store.epicgames.com/zh-CN/p/c-slug"),
                ContentItem.text("https://store.epicgames.com/zh-CN"));
    }

    @Test
    void unparseableEndDateIsRenderedAsUnknown() {
        EpicGame game = freeGame("Odd")
                .promotions(new EpicGame.Promotions(List.of(offers("next tuesday")), List.of()))
                .build();

        assertThat(last(contentProvider.render(List.of(game)))).contains("free until unknown");
    }

    private static String last(DeliveryPayload payload) {
        return payload.getItems().get(payload.getItems().size() - 1).getValue();
    }

    private static EpicGame.EpicGameBuilder freeGame(String title) {
        return EpicGame.builder()
                .title(title)
                .description("Trade among the stars.")
                .price(price("¥90.00", "0"))
                .promotions(new EpicGame.Promotions(List.of(offers("2024-05-23T15:00:00.000Z")), List.of()));
    }

    private static EpicGame.Price price(String original, String discount) {
        return new EpicGame.Price(new EpicGame.TotalPrice(new EpicGame.FormattedPrice(original, discount)));
    }

    private static EpicGame.OfferGroup offers(String endDate) {
        return new EpicGame.OfferGroup(List.of(new EpicGame.Offer("2024-05-16T15:00:00.000Z", endDate)));
    }
}
