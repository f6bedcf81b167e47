package org.gc.freegames.clients;

public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }
}
