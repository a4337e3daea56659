package io.github.drompincen.channelhub.runtime.channel;

/** What the platform told us about ourselves during connect, e.g. the bot's username. */
public record ConnectResult(String platformAccountId, String platformDisplayName) {

    public static ConnectResult ok() {
        return new ConnectResult(null, null);
    }
}
