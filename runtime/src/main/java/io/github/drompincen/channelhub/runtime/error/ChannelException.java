package io.github.drompincen.channelhub.runtime.error;

/**
 * Base of the channel failure taxonomy. {@link #reason()} is a stable code that HTTP boundaries
 * translate into statuses or redirect parameters.
 */
public class ChannelException extends RuntimeException {

    private final String reason;

    public ChannelException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ChannelException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String reason() { return reason; }
}
