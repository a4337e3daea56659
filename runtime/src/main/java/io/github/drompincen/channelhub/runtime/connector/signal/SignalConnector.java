package io.github.drompincen.channelhub.runtime.connector.signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.api.PairingStateDto;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelAttachment;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnectionConfig;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnector;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.ConnectResult;
import io.github.drompincen.channelhub.runtime.channel.ConnectorListener;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Signal through a {@code signal-cli jsonRpc} subprocess. Inbound envelopes arrive as JSON-RPC
 * notifications on stdout; sends are JSON-RPC requests on stdin. A number that is not yet linked
 * goes through device linking first, publishing the link URI as a pairing QR payload.
 */
public class SignalConnector implements ChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(SignalConnector.class);

    private static final Pattern CLI_BINARY = Pattern.compile("^signal-cli(\\.exe)?$");
    private static final Duration RPC_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration PAIRING_TIMEOUT = Duration.ofMinutes(3);

    private final SignalCliLauncher launcher;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicLong rpcIds = new AtomicLong();
    private final Map<String, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();

    private volatile Process daemon;
    private volatile ExecutorService inbound;
    private volatile ConnectorListener listener;
    private volatile String phoneNumber;
    private volatile String cliPath;

    public SignalConnector(SignalCliLauncher launcher, ObjectMapper objectMapper) {
        this.launcher = launcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChannelType type() {
        return ChannelType.SIGNAL;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        String phone = config.setting("phoneNumber");
        if (phone == null) {
            throw new CredentialMissingException("Signal phone number is missing");
        }
        String path = config.setting("signalCliPath", "signal-cli");
        String binary = path.replace('\\', '/');
        binary = binary.substring(binary.lastIndexOf('/') + 1);
        if (!CLI_BINARY.matcher(binary).matches()) {
            throw new ConnectorConnectException("signalCliPath must point to a signal-cli binary");
        }
        this.phoneNumber = phone;
        this.cliPath = path;
        this.listener = listener;
        stopping.set(false);
        cancellation.onCancel(this::disconnect);

        try {
            if (!isLinked()) {
                link(listener);
            }
            startDaemon();
        } catch (IOException e) {
            throw new ConnectorConnectException("Could not run signal-cli: " + e.getMessage(), e);
        }
        log.info("Signal daemon started for {}", mask(phone));
        return new ConnectResult(phone, phone);
    }

    @Override
    public void disconnect() {
        stopping.set(true);
        Process process = daemon;
        daemon = null;
        ExecutorService executor = inbound;
        inbound = null;
        if (executor != null) {
            executor.shutdownNow();
        }
        pending.values().forEach(f -> f.completeExceptionally(new DeliveryException("Signal connector stopped")));
        pending.clear();
        if (process != null) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
            log.info("Signal daemon stopped");
        }
    }

    @Override
    public boolean isConnected() {
        Process process = daemon;
        return process != null && process.isAlive();
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        if (!isConnected()) {
            throw new DeliveryException("Signal connector is not connected");
        }
        validateRecipient(targetId);
        JsonNode result = call("send", sendParams(targetId, content, options));
        return result.path("timestamp").asText(String.valueOf(System.currentTimeMillis()));
    }

    Map<String, Object> sendParams(String targetId, String content, SendOptions options) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (targetId.startsWith("group.")) {
            params.put("groupId", targetId.substring("group.".length()));
        } else {
            params.put("recipient", List.of(targetId));
        }
        params.put("message", content);
        if (options.replyToId() != null && options.replyToId().matches("\\d+")) {
            params.put("quoteTimestamp", Long.parseLong(options.replyToId()));
            params.put("quoteAuthor", targetId);
        }
        return params;
    }

    static void validateRecipient(String targetId) {
        if (targetId == null || targetId.startsWith("-")) {
            throw new DeliveryException("Invalid Signal recipient");
        }
        if (!targetId.startsWith("+") && !targetId.startsWith("group.") && !Character.isDigit(targetId.charAt(0))) {
            throw new DeliveryException("Signal recipient must be a phone number or group id");
        }
    }

    // ---- process plumbing ----

    private boolean isLinked() throws IOException {
        Process list = launcher.start(List.of(cliPath, "listAccounts"));
        List<String> lines = readAll(list);
        try {
            list.waitFor(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorConnectException("Interrupted while listing Signal accounts");
        }
        return lines.stream().anyMatch(l -> l.contains(phoneNumber));
    }

    private void link(ConnectorListener listener) throws IOException {
        Process linker = launcher.start(List.of(cliPath, "link", "-n", "channelhub"));
        try (BufferedReader out = new BufferedReader(new InputStreamReader(linker.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = out.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.startsWith("sgnl://") || trimmed.startsWith("tsdevice:")) {
                    log.info("Signal device link waiting for QR scan");
                    listener.onPairingUpdate(PairingStateDto.waiting(trimmed));
                }
            }
        }
        try {
            if (!linker.waitFor(PAIRING_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                linker.destroyForcibly();
                listener.onPairingUpdate(PairingStateDto.error("Pairing timed out"));
                throw new ConnectorConnectException("Signal pairing timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            linker.destroyForcibly();
            throw new ConnectorConnectException("Interrupted while pairing Signal device");
        }
        if (linker.exitValue() != 0) {
            listener.onPairingUpdate(PairingStateDto.error("signal-cli link exited with " + linker.exitValue()));
            throw new ConnectorConnectException("Signal device linking failed");
        }
        listener.onPairingUpdate(PairingStateDto.paired());
    }

    private void startDaemon() throws IOException {
        Process process = launcher.start(List.of(cliPath, "-a", phoneNumber, "jsonRpc"));
        // replies are sent from the listener, so it must not run on the thread that reads RPC answers
        inbound = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "signal-inbound");
            t.setDaemon(true);
            return t;
        });
        daemon = process;

        Thread reader = new Thread(() -> readLoop(process), "signal-rpc-reader");
        reader.setDaemon(true);
        reader.start();

        Thread errors = new Thread(() -> drainErrors(process), "signal-rpc-stderr");
        errors.setDaemon(true);
        errors.start();
    }

    private void readLoop(Process process) {
        try (BufferedReader out = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = out.readLine()) != null) {
                try {
                    handleLine(line);
                } catch (RuntimeException e) {
                    log.error("Could not handle signal-cli output: {}", e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            if (!stopping.get()) {
                log.warn("Signal daemon output failed: {}", e.getMessage());
            }
        }
        if (!stopping.get()) {
            log.error("signal-cli daemon exited unexpectedly");
            daemon = null;
            ConnectorListener current = listener;
            if (current != null) {
                current.onError(new ConnectorConnectException("signal-cli daemon exited"));
            }
        }
    }

    private void drainErrors(Process process) {
        try (BufferedReader err = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = err.readLine()) != null) {
                if (!line.isBlank()) {
                    log.debug("signal-cli: {}", line.trim());
                }
            }
        } catch (IOException e) {
            log.trace("signal-cli stderr closed: {}", e.getMessage());
        }
    }

    void handleLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return;
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("signal-cli output: {}", trimmed);
            return;
        }
        if (node.hasNonNull("id") && (node.has("result") || node.has("error"))) {
            CompletableFuture<JsonNode> future = pending.remove(node.path("id").asText());
            if (future != null) {
                future.complete(node);
            }
            return;
        }
        if ("receive".equals(node.path("method").asText())) {
            handleEnvelope(node.path("params").path("envelope"));
        }
    }

    void handleEnvelope(JsonNode envelope) {
        JsonNode data = envelope.path("dataMessage");
        if (data.isMissingNode() || !data.hasNonNull("message")) {
            return;
        }
        String source = envelope.path("sourceNumber").asText(envelope.path("source").asText("unknown"));
        String groupId = data.path("groupInfo").path("groupId").asText(null);
        List<ChannelAttachment> attachments = new ArrayList<>();
        for (JsonNode att : data.path("attachments")) {
            String mime = att.path("contentType").asText("");
            String kind = mime.startsWith("image/") ? "image" : mime.startsWith("audio/") ? "voice" : "file";
            attachments.add(new ChannelAttachment(kind, att.path("id").asText(""),
                    att.path("filename").asText("attachment"), att.path("size").asLong(0), mime));
        }
        long timestamp = data.path("timestamp").asLong(envelope.path("timestamp").asLong(System.currentTimeMillis()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sourceNumber", source);
        if (groupId != null) {
            metadata.put("groupId", groupId);
        }
        ChannelMessage.ContentType contentType = attachments.isEmpty() ? ChannelMessage.ContentType.TEXT
                : "image".equals(attachments.get(0).type()) ? ChannelMessage.ContentType.IMAGE
                : ChannelMessage.ContentType.FILE;

        ChannelMessage message = new ChannelMessage(
                String.valueOf(timestamp),
                ChannelType.SIGNAL,
                groupId != null ? "group." + groupId : source,
                null,
                data.path("message").asText(),
                contentType,
                attachments,
                envelope.path("sourceUuid").asText(source),
                envelope.path("sourceName").asText(source),
                Instant.ofEpochMilli(timestamp),
                data.path("quote").hasNonNull("id") ? data.path("quote").path("id").asText() : null,
                metadata);
        ExecutorService executor = inbound;
        if (executor == null) {
            log.debug("Signal envelope {} arrived while stopped", message.id());
            return;
        }
        executor.execute(() -> deliver(message));
    }

    private void deliver(ChannelMessage message) {
        ConnectorListener current = listener;
        if (current == null) return;
        try {
            current.onMessage(message);
        } catch (RuntimeException e) {
            log.error("Dropped Signal message {}: {}", message.id(), e.getMessage(), e);
        }
    }

    private JsonNode call(String method, Map<String, Object> params) {
        Process process = daemon;
        if (process == null) {
            throw new DeliveryException("Signal connector is not connected");
        }
        String id = String.valueOf(rpcIds.incrementAndGet());
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("method", method);
        request.put("params", params);
        request.put("id", id);

        CompletableFuture<JsonNode> response = new CompletableFuture<>();
        pending.put(id, response);
        try {
            byte[] bytes = (objectMapper.writeValueAsString(request) + "\n").getBytes(StandardCharsets.UTF_8);
            OutputStream in = process.getOutputStream();
            synchronized (this) {
                in.write(bytes);
                in.flush();
            }
            JsonNode reply = response.get(RPC_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (reply.has("error")) {
                throw new DeliveryException("Signal " + method + " failed: " + reply.path("error").path("message").asText());
            }
            return reply.path("result");
        } catch (IOException e) {
            throw new DeliveryException("Signal " + method + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted during Signal " + method);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeliveryException("Signal " + method + " got no answer: " + e.getMessage());
        } finally {
            pending.remove(id);
        }
    }

    private static List<String> readAll(Process process) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader out = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = out.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static String mask(String phone) {
        return phone.length() <= 4 ? "****" : "****" + phone.substring(phone.length() - 4);
    }
}
