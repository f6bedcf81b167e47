package org.gc.freegames.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted membership of both subscriber kinds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionDocument {

    private List<String> channel = new ArrayList<>();
    private List<String> direct = new ArrayList<>();

    public List<String> subjects(SubscriberType type) {
        if (type == SubscriberType.CHANNEL) {
            if (channel == null) {
                channel = new ArrayList<>();
            }
            return channel;
        }
        if (direct == null) {
            direct = new ArrayList<>();
        }
        return direct;
    }

    public boolean contains(Subscriber subscriber) {
        return subjects(subscriber.getType()).contains(subscriber.getSubjectId());
    }
}
