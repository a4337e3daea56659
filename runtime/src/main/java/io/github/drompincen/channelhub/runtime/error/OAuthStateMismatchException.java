package io.github.drompincen.channelhub.runtime.error;

/** The state token is unknown, expired, already used, or was issued for another channel type. */
public class OAuthStateMismatchException extends ChannelException {

    public static final String INVALID_STATE = "invalid_state";
    public static final String TYPE_MISMATCH = "type_mismatch";

    public OAuthStateMismatchException(String reason, String message) {
        super(reason, message);
    }
}
