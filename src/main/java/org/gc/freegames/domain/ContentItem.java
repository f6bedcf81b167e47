package org.gc.freegames.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.NonNull;
import lombok.Value;

/**
 * One rendered element of a push: a text block or an image url.
 */
@Value
public class ContentItem {

    @NonNull
    ContentType type;

    @NonNull
    String value;

    @JsonCreator
    public ContentItem(@JsonProperty("type") ContentType type, @JsonProperty("value") String value) {
        this.type = type;
        this.value = value;
    }

    public static ContentItem text(String text) {
        return new ContentItem(ContentType.TEXT, text);
    }

    public static ContentItem image(String url) {
        return new ContentItem(ContentType.IMAGE, url);
    }
}
