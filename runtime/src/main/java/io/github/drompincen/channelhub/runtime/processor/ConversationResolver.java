package io.github.drompincen.channelhub.runtime.processor;

import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;

/** Finds or creates the agent conversation that a channel thread maps onto. */
public interface ConversationResolver {

    String resolve(String tenantId, String accountRecordId, ChannelMessage message);
}
