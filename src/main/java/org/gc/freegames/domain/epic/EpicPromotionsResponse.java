package org.gc.freegames.domain.epic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Envelope returned by the store promotions endpoint:
 * {@code data.Catalog.searchStore.elements}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EpicPromotionsResponse {

    private Payload data;

    public List<EpicGame> elements() {
        if (data == null || data.getCatalog() == null || data.getCatalog().getSearchStore() == null) {
            return List.of();
        }
        List<EpicGame> elements = data.getCatalog().getSearchStore().getElements();
        return elements != null ? elements : List.of();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        @JsonProperty("Catalog")
        private Catalog catalog;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Catalog {
        private SearchStore searchStore;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchStore {
        private List<EpicGame> elements;
    }
}
