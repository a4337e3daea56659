package io.github.drompincen.channelhub.protocol.api;

public record ModelSelection(
        String provider,
        String model
) {}
