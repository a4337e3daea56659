package io.github.drompincen.channelhub.runtime.background;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.runtime.agent.ModelSelector;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelManager;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.error.ChannelNotFoundException;
import io.github.drompincen.channelhub.runtime.processor.ChannelMessageProcessorFactory;
import io.github.drompincen.channelhub.runtime.processor.ProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns connector lifetimes independently of any web request. Runtime state lives only in memory and is
 * rebuilt from the persisted {@code active} flag by {@link #startAllChannels()} on boot.
 *
 * <p>Concurrent starts for the same account share one in-flight operation, so two racing calls end up
 * with a single registered connector.
 */
@Service
public class ChannelBackgroundService {

    private static final Logger log = LoggerFactory.getLogger(ChannelBackgroundService.class);

    private final ChannelAccountStore accountStore;
    private final ChannelManager channelManager;
    private final ModelSelector modelSelector;
    private final ChannelMessageProcessorFactory processorFactory;
    private final Executor executor;
    private final Clock clock;

    private final Map<String, ChannelRuntimeState> states = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> cancellations = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ChannelRuntimeState>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    @Autowired
    public ChannelBackgroundService(ChannelAccountStore accountStore, ChannelManager channelManager,
                                    ModelSelector modelSelector, ChannelMessageProcessorFactory processorFactory,
                                    @Qualifier("channelTaskExecutor") Executor executor) {
        this(accountStore, channelManager, modelSelector, processorFactory, executor, Clock.systemUTC());
    }

    ChannelBackgroundService(ChannelAccountStore accountStore, ChannelManager channelManager,
                             ModelSelector modelSelector, ChannelMessageProcessorFactory processorFactory,
                             Executor executor, Clock clock) {
        this.accountStore = accountStore;
        this.channelManager = channelManager;
        this.modelSelector = modelSelector;
        this.processorFactory = processorFactory;
        this.executor = executor;
        this.clock = clock;
    }

    static String key(String tenantId, String accountId) {
        return tenantId + ":" + accountId;
    }

    // ---- lifecycle ----

    /**
     * Starts the account's connector. Without {@code force} a running channel is left alone; with it
     * the channel is stopped and started again. Connect and model-resolution failures are recorded in
     * the returned state rather than thrown.
     *
     * @throws ChannelNotFoundException if the account does not exist for the tenant
     */
    public ChannelRuntimeState startChannel(String tenantId, String accountId, boolean force) {
        String key = key(tenantId, accountId);
        while (true) {
            CompletableFuture<ChannelRuntimeState> mine = new CompletableFuture<>();
            CompletableFuture<ChannelRuntimeState> existing = inFlight.putIfAbsent(key, mine);
            if (existing != null) {
                ChannelRuntimeState shared = await(existing);
                if (!force) {
                    return shared;
                }
                continue;
            }
            try {
                ChannelRuntimeState result = doStart(tenantId, accountId, force);
                inFlight.remove(key, mine);
                mine.complete(result);
                return result;
            } catch (RuntimeException e) {
                inFlight.remove(key, mine);
                mine.completeExceptionally(e);
                throw e;
            }
        }
    }

    public CompletableFuture<ChannelRuntimeState> startChannelAsync(String tenantId, String accountId, boolean force) {
        return CompletableFuture.supplyAsync(() -> startChannel(tenantId, accountId, force), executor)
                .whenComplete((state, error) -> {
                    if (error != null) {
                        log.error("Background start of {} failed: {}", key(tenantId, accountId), error.getMessage());
                    }
                });
    }

    /**
     * Cancels and disconnects the channel. State ends up stopped even if the connector's disconnect
     * raised.
     */
    public ChannelRuntimeState stopChannel(String tenantId, String accountId) {
        CompletableFuture<ChannelRuntimeState> pending = inFlight.get(key(tenantId, accountId));
        if (pending != null) {
            try {
                await(pending);
            } catch (RuntimeException e) {
                log.debug("In-flight start of {} failed before stop: {}", key(tenantId, accountId), e.getMessage());
            }
        }
        return doStop(tenantId, accountId);
    }

    public List<ChannelRuntimeState> startUserChannels(String tenantId) {
        List<ChannelRuntimeState> result = new ArrayList<>();
        for (ChannelAccountDocument account : accountStore.listByUser(tenantId)) {
            if (!account.isActive()) {
                continue;
            }
            try {
                result.add(startChannel(tenantId, account.getId(), false));
            } catch (RuntimeException e) {
                log.error("Failed to start channel {} for tenant {}: {}", account.getId(), tenantId, e.getMessage());
            }
        }
        log.info("Started {} channel(s) for tenant {}", result.size(), tenantId);
        return result;
    }

    public void stopUserChannels(String tenantId) {
        for (ChannelRuntimeState state : getUserChannels(tenantId)) {
            stopChannel(tenantId, state.accountRecordId());
        }
        channelManager.disconnectTenant(tenantId);
        log.info("Stopped channels for tenant {}", tenantId);
    }

    /**
     * Boot-time entry point. Runs once per process; later calls return 0 without touching anything.
     *
     * @return the number of channels that ended up connected
     */
    public int startAllChannels() {
        if (!started.compareAndSet(false, true)) {
            log.debug("startAllChannels already ran");
            return 0;
        }
        List<ChannelAccountDocument> accounts = accountStore.listActive();
        long tenants = accounts.stream().map(ChannelAccountDocument::getTenantId).distinct().count();
        log.info("Starting {} active channel(s) across {} tenant(s)", accounts.size(), tenants);

        List<CompletableFuture<ChannelRuntimeState>> starts = accounts.stream()
                .map(a -> startChannelAsync(a.getTenantId(), a.getId(), false)
                        .exceptionally(e -> null))
                .toList();
        CompletableFuture.allOf(starts.toArray(new CompletableFuture[0])).join();

        int connected = (int) starts.stream()
                .map(CompletableFuture::join)
                .filter(s -> s != null && s.connected())
                .count();
        log.info("Channel boot complete: {}/{} connected", connected, accounts.size());
        return connected;
    }

    public void shutdown() {
        log.info("Shutting down {} channel runtime(s)", states.size());
        cancellations.values().forEach(CancellationToken::cancel);
        cancellations.clear();
        channelManager.shutdown();
        states.replaceAll((k, s) -> s.running() ? s.stopped(clock.instant()) : s);
        started.set(false);
    }

    /** Drops the runtime record of a deleted account. */
    public void forget(String tenantId, String accountId) {
        states.remove(key(tenantId, accountId));
    }

    // ---- status ----

    public Optional<ChannelRuntimeState> getState(String tenantId, String accountId) {
        return Optional.ofNullable(states.get(key(tenantId, accountId)));
    }

    public List<ChannelRuntimeState> getUserChannels(String tenantId) {
        return states.values().stream()
                .filter(s -> s.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(s -> s.channelType().id()))
                .toList();
    }

    public List<ChannelRuntimeState> getRunningChannels() {
        return states.values().stream().filter(ChannelRuntimeState::running).toList();
    }

    public boolean isRunning() {
        return started.get();
    }

    public boolean isRunning(String tenantId, String accountId) {
        ChannelRuntimeState state = states.get(key(tenantId, accountId));
        return state != null && state.running();
    }

    // ---- internals ----

    private ChannelRuntimeState doStart(String tenantId, String accountId, boolean force) {
        String key = key(tenantId, accountId);
        ChannelRuntimeState current = states.get(key);
        if (current != null && current.running()) {
            if (!force) {
                log.debug("Channel {} already running", key);
                return current;
            }
            log.info("Force restarting channel {}", key);
            doStop(tenantId, accountId);
        }

        ChannelAccountDocument account = accountStore.get(tenantId, accountId)
                .orElseThrow(() -> ChannelNotFoundException.account(tenantId, accountId));
        ChannelRuntimeState base = states.getOrDefault(key,
                ChannelRuntimeState.initial(tenantId, accountId, account.getChannelType(), account.getChannelId()));
        if (!account.isActive()) {
            log.info("Channel {} is inactive, not starting", key);
            return base;
        }

        ChannelRuntimeState starting = base.starting(clock.instant());
        states.put(key, starting);

        ModelSelection model;
        try {
            model = modelSelector.select(tenantId, account.getConfig());
        } catch (RuntimeException e) {
            return recordFailure(key, starting, e);
        }

        CancellationToken token = new CancellationToken();
        CancellationToken previous = cancellations.put(key, token);
        if (previous != null) {
            previous.cancel();
        }
        channelManager.setMessageHandler(this::handleInbound);

        try {
            channelManager.connectChannel(tenantId, account, true, token,
                    error -> onConnectorError(key, token, error));
        } catch (RuntimeException e) {
            cancellations.remove(key, token);
            token.cancel();
            return recordFailure(key, starting, e);
        }

        ChannelRuntimeState connected = starting.connected(model.provider(), model.model());
        states.put(key, connected);
        log.info("Channel {} ({}) connected using {}/{}", key, account.getChannelType().id(),
                model.provider(), model.model());
        return connected;
    }

    private ChannelRuntimeState recordFailure(String key, ChannelRuntimeState starting, RuntimeException e) {
        ChannelRuntimeState failed = starting.failed(e.getMessage());
        states.put(key, failed);
        log.error("Failed to start channel {}: {}", key, e.getMessage());
        return failed;
    }

    private ChannelRuntimeState doStop(String tenantId, String accountId) {
        String key = key(tenantId, accountId);
        CancellationToken token = cancellations.remove(key);
        if (token != null) {
            token.cancel();
        }

        ChannelRuntimeState state = states.get(key);
        if (state == null) {
            ChannelAccountDocument account = accountStore.get(tenantId, accountId)
                    .orElseThrow(() -> ChannelNotFoundException.account(tenantId, accountId));
            state = ChannelRuntimeState.initial(tenantId, accountId, account.getChannelType(), account.getChannelId());
        }

        try {
            channelManager.disconnectChannel(tenantId, state.channelType(), state.channelId());
        } catch (RuntimeException e) {
            log.warn("Disconnect of {} raised, marking stopped anyway: {}", key, e.getMessage());
        }

        ChannelRuntimeState stopped = state.stopped(clock.instant());
        states.put(key, stopped);
        log.info("Channel {} stopped", key);
        return stopped;
    }

    private void onConnectorError(String key, CancellationToken token, Throwable error) {
        if (token.isCancelled()) {
            log.debug("Ignoring error from cancelled channel {}: {}", key, error.getMessage());
            return;
        }
        log.error("Channel {} lost its connection: {}", key, error.getMessage());
        states.computeIfPresent(key, (k, s) -> s.failed(error.getMessage()));
    }

    private void handleInbound(String tenantId, String accountRecordId, ChannelMessage message) {
        ChannelRuntimeState state = states.get(key(tenantId, accountRecordId));
        ModelSelection model = state != null && state.model() != null
                ? new ModelSelection(state.provider(), state.model())
                : null;
        ProcessingResult result = processorFactory.create(model).process(tenantId, accountRecordId, message);
        log.debug("Processed message {} on {}: {}", message.id(), accountRecordId, result.status());
    }

    private static ChannelRuntimeState await(CompletableFuture<ChannelRuntimeState> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
