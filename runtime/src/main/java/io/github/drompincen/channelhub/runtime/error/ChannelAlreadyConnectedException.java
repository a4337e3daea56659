package io.github.drompincen.channelhub.runtime.error;

public class ChannelAlreadyConnectedException extends ChannelException {

    public ChannelAlreadyConnectedException(String message) {
        super("already_connected", message);
    }

    public ChannelAlreadyConnectedException(String message, Throwable cause) {
        super("already_connected", message, cause);
    }
}
