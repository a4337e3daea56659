package io.github.drompincen.channelhub.runtime.error;

/** Opening a channel failed. Recorded on the runtime state, never thrown out of the background service. */
public class ConnectorConnectException extends ChannelException {

    public ConnectorConnectException(String message) {
        super("connect_failed", message);
    }

    public ConnectorConnectException(String message, Throwable cause) {
        super("connect_failed", message, cause);
    }
}
