package io.github.drompincen.channelhub.runtime.channel;

/** The single process-wide sink for inbound messages from every connector. */
@FunctionalInterface
public interface ChannelMessageHandler {

    void handle(String tenantId, String accountRecordId, ChannelMessage message);
}
