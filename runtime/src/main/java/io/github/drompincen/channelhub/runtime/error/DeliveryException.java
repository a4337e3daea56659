package io.github.drompincen.channelhub.runtime.error;

/** A send to the platform failed after the channel was connected. */
public class DeliveryException extends ChannelException {

    public DeliveryException(String message) {
        super("delivery_failed", message);
    }

    public DeliveryException(String message, Throwable cause) {
        super("delivery_failed", message, cause);
    }
}
