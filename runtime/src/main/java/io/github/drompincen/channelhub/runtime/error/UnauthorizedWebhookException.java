package io.github.drompincen.channelhub.runtime.error;

public class UnauthorizedWebhookException extends ChannelException {

    public UnauthorizedWebhookException(String message) {
        super("unauthorized", message);
    }

    public UnauthorizedWebhookException(String message, Throwable cause) {
        super("unauthorized", message, cause);
    }
}
