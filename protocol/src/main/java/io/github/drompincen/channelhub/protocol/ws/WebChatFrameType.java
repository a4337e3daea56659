package io.github.drompincen.channelhub.protocol.ws;

public enum WebChatFrameType {
    // Client -> Server
    AUTH("auth"),
    CHAT_SEND("chat.send"),
    MESSAGE("message"),

    // Server -> Client
    CONNECTED("connected"),
    AUTH_SUCCESS("auth_success"),
    CHAT_START("chat.start"),
    CHAT_CHUNK("chat.chunk"),
    CHAT_END("chat.end"),
    ERROR("error");

    private final String wireName;

    WebChatFrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /** Returns null for frame types this server does not understand. */
    public static WebChatFrameType fromWire(String wireName) {
        for (WebChatFrameType type : values()) {
            if (type.wireName.equals(wireName)) return type;
        }
        return null;
    }
}
