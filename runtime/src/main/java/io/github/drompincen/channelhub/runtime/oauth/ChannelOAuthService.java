package io.github.drompincen.channelhub.runtime.oauth;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.document.OAuthStateDocument;
import io.github.drompincen.channelhub.persistence.repository.OAuthStateRepository;
import io.github.drompincen.channelhub.persistence.store.AccountFields;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.api.OAuthInitiateResponse;
import io.github.drompincen.channelhub.runtime.channel.ConnectorRegistry;
import io.github.drompincen.channelhub.runtime.channel.OAuthCapable;
import io.github.drompincen.channelhub.runtime.channel.OAuthCredentials;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.crypto.ChannelSecrets;
import io.github.drompincen.channelhub.runtime.crypto.CredentialVault;
import io.github.drompincen.channelhub.runtime.error.OAuthStateMismatchException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Authorization-code flows for OAuth-capable channel types. State tokens are random, single use and
 * expire after {@code channelhub.oauth.state-ttl}. A token is deleted as soon as it is looked up,
 * before the code exchange, so a replayed callback never succeeds.
 */
@Service
public class ChannelOAuthService {

    private static final Logger log = LoggerFactory.getLogger(ChannelOAuthService.class);

    private final ConnectorRegistry registry;
    private final OAuthStateRepository stateRepository;
    private final ChannelAccountStore accountStore;
    private final CredentialVault vault;
    private final ChannelHubProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "oauth-state-sweeper");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ChannelOAuthService(ConnectorRegistry registry, OAuthStateRepository stateRepository,
                               ChannelAccountStore accountStore, CredentialVault vault,
                               ChannelHubProperties properties) {
        this(registry, stateRepository, accountStore, vault, properties, Clock.systemUTC());
    }

    ChannelOAuthService(ConnectorRegistry registry, OAuthStateRepository stateRepository,
                        ChannelAccountStore accountStore, CredentialVault vault,
                        ChannelHubProperties properties, Clock clock) {
        this.registry = registry;
        this.stateRepository = stateRepository;
        this.accountStore = accountStore;
        this.vault = vault;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void startSweeper() {
        long interval = properties.oauth().sweepInterval().toMillis();
        sweeper.scheduleWithFixedDelay(() -> {
            try {
                purgeExpired();
            } catch (Exception e) {
                log.warn("OAuth state sweep failed: {}", e.getMessage());
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void stopSweeper() {
        sweeper.shutdownNow();
    }

    public OAuthInitiateResponse initiate(String tenantId, ChannelType type) {
        OAuthCapable oauth = oauthFor(type);
        purgeExpired();

        Instant now = clock.instant();
        OAuthStateDocument doc = new OAuthStateDocument();
        doc.setState(newStateToken());
        doc.setTenantId(tenantId);
        doc.setChannelType(type);
        doc.setCreatedAt(now);
        doc.setExpiresAt(now.plus(properties.oauth().stateTtl()));
        stateRepository.save(doc);

        String authUrl = oauth.authorizationUrl(doc.getState(), redirectUri(type));
        log.info("Initiated {} OAuth flow for tenant {}", type.id(), tenantId);
        return new OAuthInitiateResponse(authUrl, doc.getState());
    }

    /**
     * Redeems a callback. The state is consumed before the provider is contacted.
     *
     * @throws OAuthStateMismatchException if the state is unknown, expired, reused or issued for another type
     */
    public OAuthCompletion complete(ChannelType type, String code, String state) {
        purgeExpired();
        if (state == null || state.isBlank()) {
            throw new OAuthStateMismatchException(OAuthStateMismatchException.INVALID_STATE, "Missing OAuth state");
        }
        OAuthStateDocument doc = stateRepository.findById(state)
                .orElseThrow(() -> new OAuthStateMismatchException(OAuthStateMismatchException.INVALID_STATE,
                        "Unknown or already used OAuth state"));
        stateRepository.deleteById(state);

        if (doc.getExpiresAt() != null && !doc.getExpiresAt().isAfter(clock.instant())) {
            throw new OAuthStateMismatchException(OAuthStateMismatchException.INVALID_STATE, "OAuth state expired");
        }
        if (doc.getChannelType() != type) {
            throw new OAuthStateMismatchException(OAuthStateMismatchException.TYPE_MISMATCH,
                    "OAuth state was issued for " + doc.getChannelType().id() + ", not " + type.id());
        }

        OAuthCredentials credentials = oauthFor(type).exchangeCode(code, redirectUri(type));
        String tenantId = doc.getTenantId();
        String channelId = credentials.channelId() != null ? credentials.channelId() : UUID.randomUUID().toString();
        String accountId = credentials.accountId() != null ? credentials.accountId() : "bot";
        String displayName = credentials.displayName() != null
                ? credentials.displayName() : type.displayName() + " Account";

        ChannelAccountDocument account = accountStore.upsert(tenantId, type, channelId, new AccountFields(
                accountId,
                vault.encrypt(credentials.accessToken()),
                vault.encrypt(credentials.refreshToken()),
                credentials.expiresAt(),
                ChannelSecrets.seal(new HashMap<>(credentials.settings()), vault),
                displayName,
                true));
        log.info("Completed {} OAuth flow for tenant {} (account {})", type.id(), tenantId, account.getId());
        return new OAuthCompletion(tenantId, account, credentials);
    }

    /**
     * Returns usable credentials for the tenant's active account of this type, refreshing them when
     * they expire within {@code channelhub.oauth.refresh-buffer}. Null means there are no valid
     * credentials, including when the refresh exchange itself failed.
     */
    public OAuthCredentials refresh(String tenantId, ChannelType type) {
        Optional<ChannelAccountDocument> found = accountStore.listByUser(tenantId).stream()
                .filter(a -> a.getChannelType() == type && a.isActive())
                .findFirst();
        if (found.isEmpty()) {
            return null;
        }
        ChannelAccountDocument account = found.get();
        Instant expiresAt = account.getTokenExpiresAt();
        Instant threshold = clock.instant().plus(properties.oauth().refreshBuffer());
        if (expiresAt == null || expiresAt.isAfter(threshold)) {
            return current(account);
        }
        if (account.getRefreshToken() == null) {
            log.warn("{} token for tenant {} is expiring and has no refresh token", type.id(), tenantId);
            return null;
        }

        try {
            OAuthCredentials fresh = oauthFor(type).refresh(vault.decrypt(account.getRefreshToken()));
            String refreshToken = fresh.refreshToken() != null
                    ? fresh.refreshToken() : vault.decrypt(account.getRefreshToken());
            accountStore.updateTokens(account.getId(), vault.encrypt(fresh.accessToken()),
                    vault.encrypt(refreshToken), fresh.expiresAt());
            log.info("Refreshed {} token for tenant {}", type.id(), tenantId);
            return new OAuthCredentials(fresh.accessToken(), refreshToken, fresh.expiresAt(),
                    account.getChannelId(), account.getAccountId(), account.getDisplayName(), fresh.settings());
        } catch (RuntimeException e) {
            log.error("Token refresh failed for {} tenant {}: {}", type.id(), tenantId, e.getMessage());
            return null;
        }
    }

    public long purgeExpired() {
        long removed = stateRepository.deleteByExpiresAtBefore(clock.instant());
        if (removed > 0) {
            log.debug("Purged {} expired OAuth state(s)", removed);
        }
        return removed;
    }

    String redirectUri(ChannelType type) {
        return properties.publicUrl() + "/api/channels/callback/" + type.id();
    }

    private OAuthCapable oauthFor(ChannelType type) {
        return registry.oauth(type).orElseThrow(() ->
                new IllegalArgumentException("Channel type " + type.id() + " does not support OAuth"));
    }

    private OAuthCredentials current(ChannelAccountDocument account) {
        Map<String, Object> settings = account.getConfig() != null ? account.getConfig() : Map.of();
        return new OAuthCredentials(vault.decrypt(account.getAccessToken()), vault.decrypt(account.getRefreshToken()),
                account.getTokenExpiresAt(), account.getChannelId(), account.getAccountId(),
                account.getDisplayName(), ChannelSecrets.open(settings, vault));
    }

    private String newStateToken() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
