package io.github.drompincen.channelhub.runtime.agent;

import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;

/**
 * The agent reasoning loop this transport feeds. One call is one turn: inbound message in, reply text out.
 */
public interface AgentTurnPipeline {

    /**
     * @throws io.github.drompincen.channelhub.runtime.error.AgentPipelineException if no reply could be produced
     */
    String run(String tenantId, String conversationId, ChannelMessage message, ModelSelection model);
}
