package io.github.drompincen.channelhub.protocol.api;

import java.util.Locale;

public enum ChannelType {
    TELEGRAM("telegram", "Telegram", false, true, true),
    SLACK("slack", "Slack", true, true, true),
    DISCORD("discord", "Discord", true, true, true),
    WHATSAPP("whatsapp", "WhatsApp", false, true, false),
    TEAMS("teams", "Microsoft Teams", true, true, true),
    MATRIX("matrix", "Matrix", false, false, true),
    SIGNAL("signal", "Signal", false, false, false),
    WEBCHAT("webchat", "WebChat", false, false, false);

    private final String id;
    private final String displayName;
    private final boolean supportsOAuth;
    private final boolean supportsWebhooks;
    private final boolean supportsThreads;

    ChannelType(String id, String displayName, boolean supportsOAuth,
                boolean supportsWebhooks, boolean supportsThreads) {
        this.id = id;
        this.displayName = displayName;
        this.supportsOAuth = supportsOAuth;
        this.supportsWebhooks = supportsWebhooks;
        this.supportsThreads = supportsThreads;
    }

    public String id() { return id; }
    public String displayName() { return displayName; }
    public boolean supportsOAuth() { return supportsOAuth; }
    public boolean supportsWebhooks() { return supportsWebhooks; }
    public boolean supportsThreads() { return supportsThreads; }

    /**
     * Resolves the lowercase wire id ("telegram", "teams", ...) used in routes and stored records.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static ChannelType fromId(String id) {
        if (id == null) throw new IllegalArgumentException("Channel type is required");
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ChannelType type : values()) {
            if (type.id.equals(normalized)) return type;
        }
        throw new IllegalArgumentException("Unsupported channel type: " + id);
    }
}
