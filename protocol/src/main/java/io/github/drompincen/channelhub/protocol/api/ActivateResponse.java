package io.github.drompincen.channelhub.protocol.api;

import java.util.List;

public record ActivateResponse(
        int running,
        List<ChannelStatusDto> channels
) {}
