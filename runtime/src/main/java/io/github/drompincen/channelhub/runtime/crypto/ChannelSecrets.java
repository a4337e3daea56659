package io.github.drompincen.channelhub.runtime.crypto;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Secret-bearing keys inside an account's free-form config (signing secrets, app passwords).
 * They are stored as vault blobs and only opened when a connector is built.
 */
public final class ChannelSecrets {

    public static final Set<String> SECRET_KEYS = Set.of("signingSecret", "appPassword", "appToken", "clientSecret");

    private ChannelSecrets() {}

    public static Map<String, Object> seal(Map<String, Object> config, CredentialVault vault) {
        return transform(config, vault, true);
    }

    public static Map<String, Object> open(Map<String, Object> config, CredentialVault vault) {
        return transform(config, vault, false);
    }

    /** Config as shown to API consumers: secrets replaced by a presence marker. */
    public static Map<String, Object> redact(Map<String, Object> config) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (config == null) return out;
        config.forEach((k, v) -> out.put(k, SECRET_KEYS.contains(k) && v != null ? "********" : v));
        return out;
    }

    private static Map<String, Object> transform(Map<String, Object> config, CredentialVault vault, boolean seal) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (config == null) return out;
        for (Map.Entry<String, Object> e : config.entrySet()) {
            Object value = e.getValue();
            if (SECRET_KEYS.contains(e.getKey()) && value instanceof String s && !s.isEmpty()) {
                value = seal ? vault.encrypt(s) : vault.decrypt(s);
            }
            out.put(e.getKey(), value);
        }
        return out;
    }
}
