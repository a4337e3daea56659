package io.github.drompincen.channelhub.runtime.pairing;

import io.github.drompincen.channelhub.protocol.api.PairingStateDto;
import io.github.drompincen.channelhub.protocol.api.PairingStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PairingStateStoreTest {

    private final PairingStateStore store = new PairingStateStore();

    @Test
    void latestUpdateWins() {
        store.put("acc-1", PairingStateDto.waiting("sgnl://linkdevice?uuid=1"));
        store.put("acc-1", PairingStateDto.paired());

        assertThat(store.get("acc-1")).get().extracting(PairingStateDto::status).isEqualTo(PairingStatus.PAIRED);
    }

    @Test
    void clearForgetsAccount() {
        store.put("acc-1", PairingStateDto.error("Pairing timed out"));

        store.clear("acc-1");

        assertThat(store.get("acc-1")).isEmpty();
        assertThat(store.get("never-seen")).isEmpty();
    }
}
