package io.github.drompincen.channelhub.protocol.api;

public enum PairingStatus {
    WAITING_QR,
    PAIRED,
    ERROR
}
