package io.github.drompincen.channelhub.protocol.api;

import java.time.Instant;

public record PairingStateDto(
        PairingStatus status,
        String qrPayload,
        Instant updatedAt,
        String lastError
) {
    public static PairingStateDto waiting(String qrPayload) {
        return new PairingStateDto(PairingStatus.WAITING_QR, qrPayload, Instant.now(), null);
    }

    public static PairingStateDto paired() {
        return new PairingStateDto(PairingStatus.PAIRED, null, Instant.now(), null);
    }

    public static PairingStateDto error(String message) {
        return new PairingStateDto(PairingStatus.ERROR, null, Instant.now(), message);
    }
}
