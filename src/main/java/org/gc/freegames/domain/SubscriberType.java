package org.gc.freegames.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum SubscriberType {

    CHANNEL("group", Set.of("group", "grp", "ch", "channel")),
    DIRECT("private", Set.of("private", "direct", "dm"));

    private final String token;
    private final Set<String> aliases;

    SubscriberType(String token, Set<String> aliases) {
        this.token = token;
        this.aliases = aliases;
    }

    /** Token written into job ids. */
    public String getToken() {
        return token;
    }

    public static Optional<SubscriberType> fromToken(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.aliases.contains(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static SubscriberType parse(String value) {
        return fromToken(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscriber type: " + value));
    }
}
