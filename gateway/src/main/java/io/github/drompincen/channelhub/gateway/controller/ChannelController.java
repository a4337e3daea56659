package io.github.drompincen.channelhub.gateway.controller;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.store.AccountFields;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ActivateResponse;
import io.github.drompincen.channelhub.protocol.api.ChannelAccountDto;
import io.github.drompincen.channelhub.protocol.api.ChannelStatusDto;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.api.ChannelTypeDto;
import io.github.drompincen.channelhub.protocol.api.ManualConnectRequest;
import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.protocol.api.PairingStateDto;
import io.github.drompincen.channelhub.runtime.agent.ModelSelector;
import io.github.drompincen.channelhub.runtime.background.ChannelBackgroundService;
import io.github.drompincen.channelhub.runtime.background.ChannelRuntimeState;
import io.github.drompincen.channelhub.runtime.crypto.ChannelSecrets;
import io.github.drompincen.channelhub.runtime.crypto.CredentialVault;
import io.github.drompincen.channelhub.runtime.error.ChannelNotFoundException;
import io.github.drompincen.channelhub.runtime.pairing.PairingStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Tenant-facing channel management. The tenant comes from the {@code X-Tenant-Id} header. */
@RestController
@RequestMapping("/api/channels")
public class ChannelController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private static final Logger log = LoggerFactory.getLogger(ChannelController.class);

    private final ChannelAccountStore accountStore;
    private final ChannelBackgroundService backgroundService;
    private final PairingStateStore pairingStates;
    private final ModelSelector modelSelector;
    private final CredentialVault vault;
    private final ApiRateLimitGuard rateLimitGuard;

    public ChannelController(ChannelAccountStore accountStore, ChannelBackgroundService backgroundService,
                             PairingStateStore pairingStates, ModelSelector modelSelector, CredentialVault vault,
                             ApiRateLimitGuard rateLimitGuard) {
        this.accountStore = accountStore;
        this.backgroundService = backgroundService;
        this.pairingStates = pairingStates;
        this.modelSelector = modelSelector;
        this.vault = vault;
        this.rateLimitGuard = rateLimitGuard;
    }

    @GetMapping("/types")
    public List<ChannelTypeDto> types() {
        return Arrays.stream(ChannelType.values()).map(ChannelTypeDto::of).toList();
    }

    @GetMapping
    public List<ChannelAccountDto> list(@RequestHeader(TENANT_HEADER) String tenantId) {
        return accountStore.listByUser(tenantId).stream().map(ChannelController::toDto).toList();
    }

    @PostMapping("/manual/{type}")
    public ResponseEntity<ChannelAccountDto> connectManual(@RequestHeader(TENANT_HEADER) String tenantId,
                                                           @PathVariable String type,
                                                           @RequestBody ManualConnectRequest request) {
        ChannelType channelType = ChannelType.fromId(type);
        rateLimitGuard.check(tenantId);
        ManualAccount manual = manualAccount(tenantId, channelType, request);
        String displayName = request.displayName() != null && !request.displayName().isBlank()
                ? request.displayName() : channelType.displayName();

        ChannelAccountDocument saved = accountStore.upsert(tenantId, channelType, manual.channelId(), new AccountFields(
                manual.accountId(),
                manual.token() != null ? vault.encrypt(manual.token()) : null,
                null,
                null,
                ChannelSecrets.seal(manual.config(), vault),
                displayName,
                true));
        log.info("Manual {} channel {} saved for tenant {}", channelType.id(), saved.getId(), tenantId);

        backgroundService.startChannelAsync(tenantId, saved.getId(), true);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(saved));
    }

    @PostMapping("/activate")
    public ActivateResponse activate(@RequestHeader(TENANT_HEADER) String tenantId) {
        rateLimitGuard.check(tenantId);
        backgroundService.startUserChannels(tenantId);
        List<ChannelStatusDto> channels = status(tenantId);
        int running = (int) channels.stream().filter(ChannelStatusDto::running).count();
        return new ActivateResponse(running, channels);
    }

    @GetMapping("/status")
    public List<ChannelStatusDto> status(@RequestHeader(TENANT_HEADER) String tenantId) {
        return accountStore.listByUser(tenantId).stream()
                .map(account -> toStatus(account, stateOf(tenantId, account)))
                .toList();
    }

    @PostMapping("/{id}/start")
    public ChannelStatusDto start(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id) {
        ChannelAccountDocument account = require(tenantId, id);
        rateLimitGuard.check(tenantId);
        return toStatus(account, backgroundService.startChannel(tenantId, id, false));
    }

    @PostMapping("/{id}/stop")
    public ChannelStatusDto stop(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id) {
        ChannelAccountDocument account = require(tenantId, id);
        return toStatus(account, backgroundService.stopChannel(tenantId, id));
    }

    @PostMapping("/{id}/restart")
    public ChannelStatusDto restart(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id) {
        ChannelAccountDocument account = require(tenantId, id);
        rateLimitGuard.check(tenantId);
        return toStatus(account, backgroundService.startChannel(tenantId, id, true));
    }

    @PatchMapping("/{id}/active")
    public ChannelAccountDto setActive(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id,
                                       @RequestBody ActiveRequest request) {
        require(tenantId, id);
        accountStore.setActive(id, request.active());
        if (request.active()) {
            backgroundService.startChannelAsync(tenantId, id, false);
        } else {
            backgroundService.stopChannel(tenantId, id);
        }
        return toDto(require(tenantId, id));
    }

    /** Stops the channel and removes the record; the record goes even if the stop fails upstream. */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id) {
        require(tenantId, id);
        try {
            backgroundService.stopChannel(tenantId, id);
        } catch (RuntimeException e) {
            log.warn("Stopping channel {} before delete failed: {}", id, e.getMessage());
        }
        accountStore.delete(id);
        backgroundService.forget(tenantId, id);
        pairingStates.clear(id);
        log.info("Channel {} deleted for tenant {}", id, tenantId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/pairing")
    public ResponseEntity<PairingStateDto> pairing(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id) {
        require(tenantId, id);
        return pairingStates.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /** Forces a fresh start; devices that need linking publish their QR payload to the pairing state. */
    @PostMapping("/{id}/pairing")
    public ResponseEntity<Void> startPairing(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id) {
        require(tenantId, id);
        pairingStates.clear(id);
        backgroundService.startChannelAsync(tenantId, id, true);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/model")
    public ModelSelection model(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable String id) {
        return modelSelector.select(tenantId, require(tenantId, id).getConfig());
    }

    public record ActiveRequest(boolean active) {}

    record ManualAccount(String channelId, String accountId, String token, Map<String, Object> config) {}

    // Required fields differ per platform; anything missing is a 400.
    static ManualAccount manualAccount(String tenantId, ChannelType type, ManualConnectRequest request) {
        Map<String, Object> config = new LinkedHashMap<>(request.config() != null ? request.config() : Map.of());
        return switch (type) {
            case TELEGRAM -> new ManualAccount(required(request.channelId(), "channelId", type), null,
                    required(request.accessToken(), "accessToken", type), config);
            case MATRIX -> {
                config.put("homeserverUrl", required(request.homeserverUrl(), "homeserverUrl", type));
                String userId = required(request.userId(), "userId", type);
                config.put("userId", userId);
                yield new ManualAccount(required(request.channelId(), "channelId", type), userId,
                        required(request.accessToken(), "accessToken", type), config);
            }
            case TEAMS -> {
                config.put("appId", required(request.appId(), "appId", type));
                config.put("appPassword", required(request.appPassword(), "appPassword", type));
                yield new ManualAccount(required(request.channelId(), "channelId", type), request.appId(), null, config);
            }
            case SLACK -> {
                if (request.signingSecret() != null && !request.signingSecret().isBlank()) {
                    config.put("signingSecret", request.signingSecret());
                }
                yield new ManualAccount(required(request.channelId(), "channelId", type), null,
                        required(request.botToken(), "botToken", type), config);
            }
            case DISCORD -> new ManualAccount(required(request.channelId(), "channelId", type), null,
                    required(request.botToken(), "botToken", type), config);
            case SIGNAL -> {
                String phone = required(request.phoneNumber(), "phoneNumber", type);
                config.put("phoneNumber", phone);
                if (request.signalCliPath() != null && !request.signalCliPath().isBlank()) {
                    config.put("signalCliPath", request.signalCliPath());
                }
                yield new ManualAccount("signal:" + phone, phone, null, config);
            }
            case WEBCHAT -> new ManualAccount("webchat:" + tenantId, null, null, config);
            case WHATSAPP -> new ManualAccount("whatsapp:" + tenantId, null, null, config);
        };
    }

    private static String required(String value, String field, ChannelType type) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required for " + type.id());
        }
        return value.trim();
    }

    private ChannelAccountDocument require(String tenantId, String id) {
        return accountStore.get(tenantId, id).orElseThrow(() -> ChannelNotFoundException.account(tenantId, id));
    }

    private ChannelRuntimeState stateOf(String tenantId, ChannelAccountDocument account) {
        return backgroundService.getState(tenantId, account.getId()).orElseGet(() ->
                ChannelRuntimeState.initial(tenantId, account.getId(), account.getChannelType(), account.getChannelId()));
    }

    static ChannelAccountDto toDto(ChannelAccountDocument account) {
        return new ChannelAccountDto(
                account.getId(),
                account.getChannelType().id(),
                account.getChannelId(),
                account.getAccountId(),
                account.getDisplayName(),
                account.isActive(),
                account.getAccessToken() != null,
                account.getTokenExpiresAt(),
                ChannelSecrets.redact(account.getConfig()),
                account.getLastSyncAt(),
                account.getCreatedAt(),
                account.getUpdatedAt());
    }

    static ChannelStatusDto toStatus(ChannelAccountDocument account, ChannelRuntimeState state) {
        return new ChannelStatusDto(
                account.getId(),
                account.getChannelType().id(),
                account.getChannelId(),
                account.getDisplayName(),
                state.running(),
                state.connected(),
                state.lastStartAt(),
                state.lastStopAt(),
                state.lastError(),
                state.model(),
                state.provider());
    }
}
