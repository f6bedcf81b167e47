package org.gc.freegames.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.LocalTime;

/**
 * Binding of a subscriber to a daily delivery time in the reference timezone.
 */
@Value
public class DeliveryJob {

    @NonNull
    String id;
    int hour;
    int minute;
    @NonNull
    Subscriber subscriber;

    public DeliveryJob(String id, int hour, int minute, Subscriber subscriber) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour out of range: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Minute out of range: " + minute);
        }
        this.id = id;
        this.hour = hour;
        this.minute = minute;
        this.subscriber = subscriber;
    }

    /**
     * Rebuilds a job from its persisted {@code "minute hour"} value.
     *
     * @throws IllegalArgumentException if the value is not two in-range integers
     */
    public static DeliveryJob fromScheduleValue(String id, String value, Subscriber subscriber) {
        if (value == null) {
            throw new IllegalArgumentException("Missing schedule value");
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected \"minute hour\" but got \"" + value + "\"");
        }
        try {
            return new DeliveryJob(id, Integer.parseInt(parts[1]), Integer.parseInt(parts[0]), subscriber);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non-numeric schedule value \"" + value + "\"", e);
        }
    }

    public boolean matches(LocalTime time) {
        return time.getHour() == hour && time.getMinute() == minute;
    }

    /** Value persisted in the schedule document: {@code "minute hour"}. */
    public String scheduleValue() {
        return minute + " " + hour;
    }

    public String displayTime() {
        return String.format("%02d:%02d", hour, minute);
    }
}
