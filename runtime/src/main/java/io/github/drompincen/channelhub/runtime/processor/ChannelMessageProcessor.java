package io.github.drompincen.channelhub.runtime.processor;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.runtime.agent.AgentTurnPipeline;
import io.github.drompincen.channelhub.runtime.agent.ModelSelector;
import io.github.drompincen.channelhub.runtime.channel.ChannelManager;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitResult;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitRule;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one inbound message into one reply: sender gates, tenant rate limit, conversation lookup,
 * agent turn, then a send back through the account the message came from. Built fresh per message
 * by {@link ChannelMessageProcessorFactory}.
 */
public class ChannelMessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChannelMessageProcessor.class);

    static final String RATE_LIMIT_BUCKET = "channel-message";
    static final String ERROR_NOTICE =
            "I apologize, but I encountered an error while processing your message. Please try again.";
    static final String RATE_LIMIT_NOTICE =
            "You're sending messages too quickly. Please wait a moment and try again.";

    private final ChannelAccountStore accountStore;
    private final ChannelManager channelManager;
    private final RateLimiter rateLimiter;
    private final RateLimitRule rateLimitRule;
    private final ConversationResolver conversations;
    private final AgentTurnPipeline pipeline;
    private final ModelSelector modelSelector;
    private final ModelSelection defaultModel;

    ChannelMessageProcessor(ChannelAccountStore accountStore, ChannelManager channelManager, RateLimiter rateLimiter,
                            RateLimitRule rateLimitRule, ConversationResolver conversations, AgentTurnPipeline pipeline,
                            ModelSelector modelSelector, ModelSelection defaultModel) {
        this.accountStore = accountStore;
        this.channelManager = channelManager;
        this.rateLimiter = rateLimiter;
        this.rateLimitRule = rateLimitRule;
        this.conversations = conversations;
        this.pipeline = pipeline;
        this.modelSelector = modelSelector;
        this.defaultModel = defaultModel;
    }

    public ProcessingResult process(String tenantId, String accountRecordId, ChannelMessage message) {
        ChannelAccountDocument account = accountStore.get(tenantId, accountRecordId).orElse(null);
        if (account == null) {
            log.warn("Dropping message for unknown account {}", accountRecordId);
            return ProcessingResult.skipped("account_not_found");
        }
        Map<String, Object> config = account.getConfig() != null ? account.getConfig() : Map.of();

        if (Boolean.FALSE.equals(config.get("autoReplyEnabled"))) {
            log.debug("Auto-reply disabled for account {}", accountRecordId);
            return ProcessingResult.skipped("auto_reply_disabled");
        }
        if (!senderAllowed(config, message.senderId())) {
            log.debug("Sender {} filtered for account {}", message.senderId(), accountRecordId);
            return ProcessingResult.skipped("sender_filtered");
        }
        if (message.content() == null || message.content().isBlank()) {
            return ProcessingResult.skipped("empty_message");
        }

        RateLimitResult limit = rateLimiter.check("tenant:" + tenantId, RATE_LIMIT_BUCKET, rateLimitRule);
        if (!limit.allowed()) {
            log.warn("Rate limit exceeded for tenant {} until {}", tenantId, limit.resetAt());
            trySend(tenantId, account, message, RATE_LIMIT_NOTICE);
            return ProcessingResult.rateLimited();
        }

        String conversationId = conversations.resolve(tenantId, accountRecordId, message);

        String reply;
        try {
            reply = pipeline.run(tenantId, conversationId, message, resolveModel(tenantId, config));
        } catch (RuntimeException e) {
            log.error("Agent turn failed for conversation {}: {}", conversationId, e.getMessage());
            trySend(tenantId, account, message, ERROR_NOTICE);
            return ProcessingResult.failed(conversationId, e.getMessage());
        }
        if (reply == null || reply.isBlank()) {
            return ProcessingResult.skipped("empty_reply");
        }

        try {
            String messageId = send(tenantId, account, message, reply);
            return ProcessingResult.replied(conversationId, messageId);
        } catch (RuntimeException e) {
            log.error("Reply delivery failed on {}: {}", account.getChannelType().id(), e.getMessage());
            return ProcessingResult.failed(conversationId, e.getMessage());
        }
    }

    private ModelSelection resolveModel(String tenantId, Map<String, Object> config) {
        return modelSelector.explicit(config)
                .or(() -> Optional.ofNullable(defaultModel))
                .orElseGet(() -> modelSelector.select(tenantId, config));
    }

    private String send(String tenantId, ChannelAccountDocument account, ChannelMessage original, String content) {
        return channelManager.sendMessage(tenantId, account.getChannelType(), account.getChannelId(),
                original.channelId(), content, new SendOptions(original.threadId(), original.id()));
    }

    private void trySend(String tenantId, ChannelAccountDocument account, ChannelMessage original, String content) {
        try {
            send(tenantId, account, original, content);
        } catch (RuntimeException e) {
            log.warn("Could not deliver notice on {}: {}", account.getChannelType().id(), e.getMessage());
        }
    }

    private static boolean senderAllowed(Map<String, Object> config, String senderId) {
        if (config.get("blockedUsers") instanceof Collection<?> blocked && senderId != null
                && blocked.stream().anyMatch(u -> senderId.equals(String.valueOf(u)))) {
            return false;
        }
        if (config.get("allowedUsers") instanceof Collection<?> allowed && !allowed.isEmpty()) {
            return senderId != null && allowed.stream().anyMatch(u -> senderId.equals(String.valueOf(u)));
        }
        return true;
    }
}
