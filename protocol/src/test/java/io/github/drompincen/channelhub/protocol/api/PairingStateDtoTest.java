package io.github.drompincen.channelhub.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PairingStateDtoTest {

    @Test
    void waitingCarriesQrPayload() {
        PairingStateDto state = PairingStateDto.waiting("sgnl://linkdevice?uuid=abc");

        assertThat(state.status()).isEqualTo(PairingStatus.WAITING_QR);
        assertThat(state.qrPayload()).isEqualTo("sgnl://linkdevice?uuid=abc");
        assertThat(state.updatedAt()).isNotNull();
        assertThat(state.lastError()).isNull();
    }

    @Test
    void errorCarriesMessage() {
        PairingStateDto state = PairingStateDto.error("link timed out");

        assertThat(state.status()).isEqualTo(PairingStatus.ERROR);
        assertThat(state.lastError()).isEqualTo("link timed out");
        assertThat(state.qrPayload()).isNull();
    }
}
