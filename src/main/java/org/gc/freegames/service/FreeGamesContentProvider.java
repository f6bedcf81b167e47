package org.gc.freegames.service;

import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.clients.EpicStoreClient;
import org.gc.freegames.domain.ContentItem;
import org.gc.freegames.domain.DeliveryPayload;
import org.gc.freegames.domain.epic.EpicGame;
import org.gc.freegames.properties.FreeGamesProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders the store's currently free games into a push payload.
 */
@Slf4j
@Service
public class FreeGamesContentProvider implements ContentProvider {

    static final String STORE_UNAVAILABLE = "The Epic store may be having trouble, please try again later.";
    static final String NO_FREE_GAMES = "No free promotions found right now...";

    private static final Set<String> PREVIEW_IMAGE_TYPES =
            Set.of("Thumbnail", "VaultOpened", "DieselStoreFrontWide", "OfferImageWide");
    private static final String TEST_PUBLISHER = "Epic Dev Test Account";
    private static final String UNKNOWN = "unknown";
    private static final DateTimeFormatter END_DATE_FORMAT = DateTimeFormatter.ofPattern("M/d HH:mm");

    private final EpicStoreClient epicStoreClient;
    private final ZoneOffset referenceZone;
    private final String storeUrl;
    private final String locale;

    public FreeGamesContentProvider(EpicStoreClient epicStoreClient, FreeGamesProperties properties) {
        this.epicStoreClient = epicStoreClient;
        this.referenceZone = properties.getScheduler().referenceOffset();
        this.storeUrl = properties.getProvider().getStoreUrl();
        this.locale = properties.getProvider().getLocale();
    }

    @Override
    public Mono<DeliveryPayload> fetchContent() {
        return epicStoreClient.fetchPromotions().map(this::render);
    }

    DeliveryPayload render(List<EpicGame> games) {
        if (games == null || games.isEmpty()) {
            return DeliveryPayload.of(ContentItem.text(STORE_UNAVAILABLE));
        }
        log.debug("Received {} games: {}", games.size(),
                games.stream().map(EpicGame::getTitle).collect(Collectors.joining(", ")));

        List<ContentItem> items = new ArrayList<>();
        int freeGames = 0;
        for (EpicGame game : games) {
            try {
                List<ContentItem> rendered = renderGame(game);
                if (!rendered.isEmpty()) {
                    items.addAll(rendered);
                    freeGames++;
                }
            } catch (RuntimeException e) {
                log.debug("Skipping game {} after render error: {}", game.getTitle(), e.getMessage());
            }
        }

        items.add(0, ContentItem.text(freeGames > 0 ? freeGames + " game(s) free right now!" : NO_FREE_GAMES));
        return new DeliveryPayload(items);
    }

    private List<ContentItem> renderGame(EpicGame game) {
        String title = Optional.ofNullable(game.getTitle()).orElse(UNKNOWN);
        EpicGame.Promotions promotions = game.getPromotions();
        if (promotions == null) {
            return List.of();
        }

        EpicGame.FormattedPrice price = Optional.ofNullable(game.getPrice())
                .map(EpicGame.Price::getTotalPrice)
                .map(EpicGame.TotalPrice::getFmtPrice)
                .orElse(new EpicGame.FormattedPrice(UNKNOWN, UNKNOWN));
        String originalPrice = Objects.requireNonNullElse(price.getOriginalPrice(), UNKNOWN);
        String discountPrice = Objects.requireNonNullElse(price.getDiscountPrice(), UNKNOWN);

        List<EpicGame.OfferGroup> current = promotions.getPromotionalOffers();
        if (current == null || current.isEmpty()) {
            List<EpicGame.OfferGroup> upcoming = promotions.getUpcomingPromotionalOffers();
            if (upcoming != null && !upcoming.isEmpty()) {
                log.info("Skipping upcoming free game: {} ({})", title, discountPrice);
            }
            return List.of();
        }
        if (!"0".equals(discountPrice)) {
            log.info("Skipping discounted but not free game: {} ({})", title, discountPrice);
            return List.of();
        }

        List<ContentItem> items = new ArrayList<>();
        previewImage(game).ifPresent(url -> items.add(ContentItem.image(url)));
        items.add(ContentItem.text(storeLink(game)));
        items.add(ContentItem.text(String.format("%s (%s)\n\n%s\n\n%sfree until %s, grab it from the link above!",
                title, originalPrice, Objects.requireNonNullElse(game.getDescription(), ""),
                publisherClause(game), endDate(current))));
        return items;
    }

    private Optional<String> previewImage(EpicGame game) {
        if (game.getKeyImages() == null) {
            return Optional.empty();
        }
        return game.getKeyImages().stream()
                .filter(image -> image.getUrl() != null && !image.getUrl().isEmpty())
                .filter(image -> PREVIEW_IMAGE_TYPES.contains(image.getType()))
                .map(EpicGame.KeyImage::getUrl)
                .findFirst();
    }

    private String publisherClause(EpicGame game) {
        String seller = game.getSeller() != null && game.getSeller().getName() != null
                ? game.getSeller().getName() : UNKNOWN;
        String developer = seller;
        String publisher = seller;
        for (EpicGame.CustomAttribute attribute : nullSafe(game.getCustomAttributes())) {
            if ("developerName".equals(attribute.getKey())) {
                developer = attribute.getValue();
            } else if ("publisherName".equals(attribute.getKey())) {
                publisher = attribute.getValue();
            }
        }
        if (TEST_PUBLISHER.equals(publisher)) {
            return "";
        }
        return Objects.equals(developer, publisher)
                ? "Published by " + publisher + ", "
                : "Developed by " + developer + " and published by " + publisher + ", ";
    }

    private String endDate(List<EpicGame.OfferGroup> current) {
        List<EpicGame.Offer> offers = current.get(0).getPromotionalOffers();
        if (offers == null || offers.isEmpty() || offers.get(0).getEndDate() == null) {
            return UNKNOWN;
        }
        try {
            return OffsetDateTime.parse(offers.get(0).getEndDate())
                    .withOffsetSameInstant(referenceZone)
                    .format(END_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return UNKNOWN;
        }
    }

    private String storeLink(EpicGame game) {
        if (game.getUrl() != null && !game.getUrl().isEmpty()) {
            return game.getUrl();
        }
        Stream<String> offerSlugs = productHomeSlugs(game.getOfferMappings());
        Stream<String> catalogSlugs = productHomeSlugs(
                game.getCatalogNs() != null ? game.getCatalogNs().getMappings() : null);
        Stream<String> attributeSlugs = nullSafe(game.getCustomAttributes()).stream()
                .filter(attribute -> attribute.getKey() != null && attribute.getKey().contains("productSlug"))
                .map(EpicGame.CustomAttribute::getValue);

        return Stream.of(offerSlugs, catalogSlugs, attributeSlugs)
                .flatMap(slugs -> slugs)
                .filter(slug -> slug != null && !slug.isEmpty())
                .findFirst()
                .map(slug -> storeUrl + "/" + locale + "/p/" + slug)
                .orElse(storeUrl + "/" + locale);
    }

    private static Stream<String> productHomeSlugs(List<EpicGame.PageMapping> mappings) {
        return nullSafe(mappings).stream()
                .filter(mapping -> "productHome".equals(mapping.getPageType()))
                .map(EpicGame.PageMapping::getPageSlug);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
