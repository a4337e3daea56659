package io.github.drompincen.channelhub.runtime.error;

/** No usable upstream credential (model API key, bot token, OAuth client) is configured. */
public class CredentialMissingException extends ChannelException {

    public CredentialMissingException(String message) {
        super("credential_missing", message);
    }

    public CredentialMissingException(String message, Throwable cause) {
        super("credential_missing", message, cause);
    }
}
