package org.gc.freegames.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * A chat channel or a direct recipient that receives pushes.
 */
@Value
public class Subscriber {

    @NonNull
    SubscriberType type;

    @NonNull
    String subjectId;

    public static Subscriber channel(String subjectId) {
        return new Subscriber(SubscriberType.CHANNEL, subjectId);
    }

    public static Subscriber direct(String subjectId) {
        return new Subscriber(SubscriberType.DIRECT, subjectId);
    }

    @Override
    public String toString() {
        return type.getToken() + ":" + subjectId;
    }
}
