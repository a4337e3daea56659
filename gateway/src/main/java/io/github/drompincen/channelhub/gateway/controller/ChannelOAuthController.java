package io.github.drompincen.channelhub.gateway.controller;

import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.api.OAuthInitiateResponse;
import io.github.drompincen.channelhub.runtime.background.ChannelBackgroundService;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.error.ChannelException;
import io.github.drompincen.channelhub.runtime.oauth.ChannelOAuthService;
import io.github.drompincen.channelhub.runtime.oauth.OAuthCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

@RestController
@RequestMapping("/api/channels")
public class ChannelOAuthController {

    private static final Logger log = LoggerFactory.getLogger(ChannelOAuthController.class);

    private final ChannelOAuthService oauthService;
    private final ChannelBackgroundService backgroundService;
    private final ChannelHubProperties properties;
    private final ApiRateLimitGuard rateLimitGuard;

    public ChannelOAuthController(ChannelOAuthService oauthService, ChannelBackgroundService backgroundService,
                                  ChannelHubProperties properties, ApiRateLimitGuard rateLimitGuard) {
        this.oauthService = oauthService;
        this.backgroundService = backgroundService;
        this.properties = properties;
        this.rateLimitGuard = rateLimitGuard;
    }

    @GetMapping("/connect/{type}")
    public OAuthInitiateResponse initiate(@RequestHeader(ChannelController.TENANT_HEADER) String tenantId,
                                          @PathVariable String type) {
        ChannelType channelType = ChannelType.fromId(type);
        rateLimitGuard.check(tenantId);
        return oauthService.initiate(tenantId, channelType);
    }

    /**
     * Provider redirect target. Always answers with a redirect to the settings page, carrying
     * {@code success=true} or {@code error=<reason>}.
     */
    @GetMapping("/callback/{type}")
    public ResponseEntity<Void> callback(@PathVariable String type,
                                         @RequestParam(required = false) String code,
                                         @RequestParam(required = false) String state,
                                         @RequestParam(required = false) String error) {
        if (error != null) {
            log.warn("OAuth provider returned error for {}: {}", type, error);
            return redirect("error", error);
        }
        if (code == null || state == null) {
            return redirect("error", "missing_params");
        }

        OAuthCompletion completion;
        try {
            completion = oauthService.complete(ChannelType.fromId(type), code, state);
        } catch (ChannelException e) {
            log.warn("OAuth callback for {} rejected: {}", type, e.getMessage());
            return redirect("error", e.reason());
        } catch (IllegalArgumentException e) {
            log.warn("OAuth callback for unsupported type {}: {}", type, e.getMessage());
            return redirect("error", "unknown_channel");
        } catch (RuntimeException e) {
            log.error("OAuth callback for {} failed: {}", type, e.getMessage(), e);
            return redirect("error", "oauth_failed");
        }

        backgroundService.startChannelAsync(completion.tenantId(), completion.account().getId(), true);
        return redirect("success", "true");
    }

    private ResponseEntity<Void> redirect(String param, String value) {
        URI location = UriComponentsBuilder.fromHttpUrl(properties.publicUrl())
                .path("/settings/channels")
                .queryParam(param, value)
                .encode()
                .build()
                .toUri();
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }
}
