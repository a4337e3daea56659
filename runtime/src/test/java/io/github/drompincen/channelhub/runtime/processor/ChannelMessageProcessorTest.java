package io.github.drompincen.channelhub.runtime.processor;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.runtime.agent.AgentTurnPipeline;
import io.github.drompincen.channelhub.runtime.agent.ModelSelector;
import io.github.drompincen.channelhub.runtime.channel.ChannelManager;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.error.AgentPipelineException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitResult;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitRule;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChannelMessageProcessorTest {

    private static final RateLimitRule RULE = new RateLimitRule(30, 60);
    private static final ModelSelection CLAUDE = new ModelSelection("anthropic", "claude-sonnet-4-20250514");

    @Mock private ChannelAccountStore accountStore;
    @Mock private ChannelManager channelManager;
    @Mock private RateLimiter rateLimiter;
    @Mock private ConversationResolver conversations;
    @Mock private AgentTurnPipeline pipeline;
    @Mock private ModelSelector modelSelector;

    private ChannelMessageProcessor processor;
    private final ChannelMessage message = new ChannelMessage("42", ChannelType.TELEGRAM, "555", "7", "hello",
            ChannelMessage.ContentType.TEXT, null, "9", "Ada", Instant.now(), null, null);

    @BeforeEach
    void setUp() {
        processor = new ChannelMessageProcessor(accountStore, channelManager, rateLimiter, RULE, conversations,
                pipeline, modelSelector, CLAUDE);
    }

    @Test
    void repliesInTheSameThreadQuotingTheMessage() {
        givenAccount(Map.of());
        givenAllowed();
        when(modelSelector.explicit(any())).thenReturn(Optional.empty());
        when(conversations.resolve("u1", "acc-1", message)).thenReturn("conv-1");
        when(pipeline.run("u1", "conv-1", message, CLAUDE)).thenReturn("hi Ada");
        when(channelManager.sendMessage("u1", ChannelType.TELEGRAM, "555", "555", "hi Ada",
                new SendOptions("7", "42"))).thenReturn("77");

        ProcessingResult result = processor.process("u1", "acc-1", message);

        assertThat(result.status()).isEqualTo(ProcessingResult.Status.REPLIED);
        assertThat(result.conversationId()).isEqualTo("conv-1");
        assertThat(result.responseMessageId()).isEqualTo("77");
    }

    @Test
    void accountModelOverridesChannelDefault() {
        ModelSelection pinned = new ModelSelection("openai", "gpt-4o");
        givenAccount(Map.of("model", "gpt-4o"));
        givenAllowed();
        when(modelSelector.explicit(any())).thenReturn(Optional.of(pinned));
        when(conversations.resolve("u1", "acc-1", message)).thenReturn("conv-1");
        when(pipeline.run("u1", "conv-1", message, pinned)).thenReturn("ok");

        processor.process("u1", "acc-1", message);

        verify(pipeline).run("u1", "conv-1", message, pinned);
    }

    @Test
    void unknownAccountIsSkipped() {
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.empty());

        ProcessingResult result = processor.process("u1", "acc-1", message);

        assertThat(result.status()).isEqualTo(ProcessingResult.Status.SKIPPED);
        assertThat(result.error()).isEqualTo("account_not_found");
        verifyNoInteractions(pipeline);
    }

    @Test
    void disabledAutoReplyIsSkipped() {
        givenAccount(Map.of("autoReplyEnabled", false));

        assertThat(processor.process("u1", "acc-1", message).error()).isEqualTo("auto_reply_disabled");
        verifyNoInteractions(rateLimiter, pipeline);
    }

    @Test
    void blockedAndUnlistedSendersAreFiltered() {
        givenAccount(Map.of("blockedUsers", List.of("9")));
        assertThat(processor.process("u1", "acc-1", message).error()).isEqualTo("sender_filtered");

        givenAccount(Map.of("allowedUsers", List.of(1, 2)));
        assertThat(processor.process("u1", "acc-1", message).error()).isEqualTo("sender_filtered");

        verifyNoInteractions(pipeline);
    }

    @Test
    void allowListMatchesNumericIds() {
        givenAccount(Map.of("allowedUsers", List.of(9)));
        givenAllowed();
        when(modelSelector.explicit(any())).thenReturn(Optional.empty());
        when(conversations.resolve("u1", "acc-1", message)).thenReturn("conv-1");
        when(pipeline.run("u1", "conv-1", message, CLAUDE)).thenReturn("ok");

        assertThat(processor.process("u1", "acc-1", message).status()).isEqualTo(ProcessingResult.Status.REPLIED);
    }

    @Test
    void emptyMessageIsSkipped() {
        givenAccount(Map.of());
        ChannelMessage blank = ChannelMessage.text("43", ChannelType.TELEGRAM, "555", "  ", "9", "Ada");

        assertThat(processor.process("u1", "acc-1", blank).error()).isEqualTo("empty_message");
    }

    @Test
    void rateLimitedSenderGetsNoticeAndNoAgentTurn() {
        givenAccount(Map.of());
        when(rateLimiter.check("tenant:u1", ChannelMessageProcessor.RATE_LIMIT_BUCKET, RULE))
                .thenReturn(new RateLimitResult(false, 0, Instant.now().plusSeconds(30)));

        ProcessingResult result = processor.process("u1", "acc-1", message);

        assertThat(result.status()).isEqualTo(ProcessingResult.Status.RATE_LIMITED);
        verify(channelManager).sendMessage(eq("u1"), eq(ChannelType.TELEGRAM), eq("555"), eq("555"),
                eq(ChannelMessageProcessor.RATE_LIMIT_NOTICE), any());
        verifyNoInteractions(pipeline, conversations);
    }

    @Test
    void pipelineFailureSendsApologyAndReportsFailure() {
        givenAccount(Map.of());
        givenAllowed();
        when(modelSelector.explicit(any())).thenReturn(Optional.empty());
        when(conversations.resolve("u1", "acc-1", message)).thenReturn("conv-1");
        when(pipeline.run("u1", "conv-1", message, CLAUDE)).thenThrow(new AgentPipelineException("upstream 502"));

        ProcessingResult result = processor.process("u1", "acc-1", message);

        assertThat(result.status()).isEqualTo(ProcessingResult.Status.FAILED);
        assertThat(result.error()).contains("upstream 502");
        verify(channelManager).sendMessage(eq("u1"), eq(ChannelType.TELEGRAM), eq("555"), eq("555"),
                eq(ChannelMessageProcessor.ERROR_NOTICE), any());
    }

    @Test
    void emptyReplyIsNotSent() {
        givenAccount(Map.of());
        givenAllowed();
        when(modelSelector.explicit(any())).thenReturn(Optional.empty());
        when(conversations.resolve("u1", "acc-1", message)).thenReturn("conv-1");
        when(pipeline.run("u1", "conv-1", message, CLAUDE)).thenReturn(" ");

        assertThat(processor.process("u1", "acc-1", message).error()).isEqualTo("empty_reply");
        verify(channelManager, never()).sendMessage(any(), any(), any(), any(), anyString(), any());
    }

    @Test
    void deliveryFailureIsReportedNotThrown() {
        givenAccount(Map.of());
        givenAllowed();
        when(modelSelector.explicit(any())).thenReturn(Optional.empty());
        when(conversations.resolve("u1", "acc-1", message)).thenReturn("conv-1");
        when(pipeline.run("u1", "conv-1", message, CLAUDE)).thenReturn("hi");
        when(channelManager.sendMessage(any(), any(), any(), any(), anyString(), any()))
                .thenThrow(new DeliveryException("Telegram sendMessage failed: Forbidden"));

        ProcessingResult result = processor.process("u1", "acc-1", message);

        assertThat(result.status()).isEqualTo(ProcessingResult.Status.FAILED);
        assertThat(result.conversationId()).isEqualTo("conv-1");
    }

    private void givenAccount(Map<String, Object> config) {
        ChannelAccountDocument account = new ChannelAccountDocument();
        account.setId("acc-1");
        account.setTenantId("u1");
        account.setChannelType(ChannelType.TELEGRAM);
        account.setChannelId("555");
        account.setConfig(config);
        account.setActive(true);
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(account));
    }

    private void givenAllowed() {
        when(rateLimiter.check("tenant:u1", ChannelMessageProcessor.RATE_LIMIT_BUCKET, RULE))
                .thenReturn(new RateLimitResult(true, 29, Instant.now().plusSeconds(60)));
    }
}
