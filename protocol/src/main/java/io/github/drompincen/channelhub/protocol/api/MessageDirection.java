package io.github.drompincen.channelhub.protocol.api;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
