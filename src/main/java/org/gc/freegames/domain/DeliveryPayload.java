package org.gc.freegames.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class DeliveryPayload {

    List<ContentItem> items;

    @JsonCreator
    public DeliveryPayload(@JsonProperty("items") List<ContentItem> items) {
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public static DeliveryPayload of(ContentItem... items) {
        return new DeliveryPayload(List.of(items));
    }
}
