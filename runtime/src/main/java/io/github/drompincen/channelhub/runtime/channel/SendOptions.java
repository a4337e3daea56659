package io.github.drompincen.channelhub.runtime.channel;

public record SendOptions(String threadId, String replyToId) {

    private static final SendOptions NONE = new SendOptions(null, null);

    public static SendOptions none() {
        return NONE;
    }
}
