package io.github.drompincen.channelhub.runtime.error;

/** The agent-turn pipeline could not produce a reply. */
public class AgentPipelineException extends ChannelException {

    public AgentPipelineException(String message) {
        super("pipeline_failed", message);
    }

    public AgentPipelineException(String message, Throwable cause) {
        super("pipeline_failed", message, cause);
    }
}
