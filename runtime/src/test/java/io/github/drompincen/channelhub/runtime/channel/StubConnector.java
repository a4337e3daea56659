package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.ChannelType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory connector that records what the runtime asks of it. */
public class StubConnector implements ChannelConnector {

    public record Sent(String targetId, String content, SendOptions options) {}

    private final ChannelType type;
    public final List<ChannelConnectionConfig> connects = new CopyOnWriteArrayList<>();
    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    public final AtomicInteger disconnects = new AtomicInteger();
    public volatile RuntimeException connectFailure;
    public volatile CountDownLatch connectGate;
    public volatile RuntimeException sendFailure;
    public volatile ConnectorListener listener;
    public volatile CancellationToken cancellation;
    private volatile boolean connected;

    public StubConnector(ChannelType type) {
        this.type = type;
    }

    @Override
    public ChannelType type() {
        return type;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        connects.add(config);
        CountDownLatch gate = connectGate;
        if (gate != null) {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        if (connectFailure != null) {
            throw connectFailure;
        }
        this.listener = listener;
        this.cancellation = cancellation;
        connected = true;
        return new ConnectResult(config.accountId(), type.displayName());
    }

    @Override
    public void disconnect() {
        disconnects.incrementAndGet();
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        if (sendFailure != null) {
            throw sendFailure;
        }
        sent.add(new Sent(targetId, content, options));
        return "out-" + sent.size();
    }

    /** Delivers an inbound message the way a platform callback would. */
    public void inbound(ChannelMessage message) {
        listener.onMessage(message);
    }
}
