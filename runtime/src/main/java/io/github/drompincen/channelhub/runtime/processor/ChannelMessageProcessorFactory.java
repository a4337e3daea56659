package io.github.drompincen.channelhub.runtime.processor;

import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.runtime.agent.AgentTurnPipeline;
import io.github.drompincen.channelhub.runtime.agent.ModelSelector;
import io.github.drompincen.channelhub.runtime.channel.ChannelManager;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitRule;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimiter;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

@Component
public class ChannelMessageProcessorFactory {

    private final ChannelAccountStore accountStore;
    private final ChannelManager channelManager;
    private final RateLimiter rateLimiter;
    private final RateLimitRule rateLimitRule;
    private final ConversationResolver conversations;
    private final AgentTurnPipeline pipeline;
    private final ModelSelector modelSelector;

    public ChannelMessageProcessorFactory(ChannelAccountStore accountStore, @Lazy ChannelManager channelManager,
                                          RateLimiter rateLimiter, ConversationResolver conversations,
                                          AgentTurnPipeline pipeline, ModelSelector modelSelector,
                                          ChannelHubProperties properties) {
        this.accountStore = accountStore;
        this.channelManager = channelManager;
        this.rateLimiter = rateLimiter;
        this.conversations = conversations;
        this.pipeline = pipeline;
        this.modelSelector = modelSelector;
        ChannelHubProperties.RateLimit limit = properties.channels().rateLimit();
        this.rateLimitRule = new RateLimitRule(limit.limit(), limit.windowSeconds());
    }

    public ChannelMessageProcessor create(ModelSelection defaultModel) {
        return new ChannelMessageProcessor(accountStore, channelManager, rateLimiter, rateLimitRule,
                conversations, pipeline, modelSelector, defaultModel);
    }
}
