package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.ChannelType;

import java.util.function.Supplier;

public interface ConnectorFactory {

    ChannelType type();

    ChannelConnector create();

    static ConnectorFactory of(ChannelType type, Supplier<ChannelConnector> supplier) {
        return new ConnectorFactory() {
            @Override public ChannelType type() { return type; }
            @Override public ChannelConnector create() { return supplier.get(); }
        };
    }
}
