package io.github.drompincen.channelhub.gateway;

import io.github.drompincen.channelhub.runtime.background.ChannelBackgroundService;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Reopens every active channel once the application is up and closes them all on shutdown. */
@Component
public class ChannelBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ChannelBootstrap.class);

    private final ChannelBackgroundService backgroundService;
    private final ChannelHubProperties properties;

    public ChannelBootstrap(ChannelBackgroundService backgroundService, ChannelHubProperties properties) {
        this.backgroundService = backgroundService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.channels().autoStart()) {
            log.info("Channel auto-start disabled");
            return;
        }
        try {
            backgroundService.startAllChannels();
        } catch (RuntimeException e) {
            log.error("Channel boot failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void onShutdown() {
        backgroundService.shutdown();
    }
}
