package io.github.drompincen.channelhub.runtime.pairing;

import io.github.drompincen.channelhub.protocol.api.PairingStateDto;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pairing progress of QR-linked channels, keyed by account record id. Written by connectors as the
 * platform handshake advances, read by API consumers that poll it. Not persisted.
 */
@Component
public class PairingStateStore {

    private final Map<String, PairingStateDto> states = new ConcurrentHashMap<>();

    public void put(String accountRecordId, PairingStateDto state) {
        states.put(accountRecordId, state);
    }

    public Optional<PairingStateDto> get(String accountRecordId) {
        return Optional.ofNullable(states.get(accountRecordId));
    }

    public void clear(String accountRecordId) {
        states.remove(accountRecordId);
    }
}
