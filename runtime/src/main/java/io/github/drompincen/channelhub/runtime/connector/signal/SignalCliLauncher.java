package io.github.drompincen.channelhub.runtime.connector.signal;

import java.io.IOException;
import java.util.List;

/** Starts {@code signal-cli} processes. Separate so the connector can run against a stand-in binary. */
@FunctionalInterface
public interface SignalCliLauncher {

    Process start(List<String> command) throws IOException;

    static SignalCliLauncher processBuilder() {
        return command -> new ProcessBuilder(command).redirectErrorStream(false).start();
    }
}
