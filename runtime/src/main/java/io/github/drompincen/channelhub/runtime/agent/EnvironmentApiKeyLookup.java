package io.github.drompincen.channelhub.runtime.agent;

import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Deployment-wide keys shared by every tenant: {@code channelhub.models.keys.<provider>} first, then the
 * provider's conventional environment variable ({@code ANTHROPIC_API_KEY}, {@code OPENAI_API_KEY}, ...).
 */
@Component
public class EnvironmentApiKeyLookup implements ApiKeyLookup {

    private static final Map<String, String> ENV_VARS = Map.of(
            "anthropic", "ANTHROPIC_API_KEY",
            "openai", "OPENAI_API_KEY",
            "google", "GOOGLE_GENERATIVE_AI_API_KEY",
            "xai", "XAI_API_KEY",
            "openrouter", "OPENROUTER_API_KEY");

    private final ChannelHubProperties properties;
    private final Environment environment;

    public EnvironmentApiKeyLookup(ChannelHubProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @Override
    public boolean hasKey(String tenantId, String provider) {
        String normalized = provider.toLowerCase(Locale.ROOT);
        if (isReal(properties.models().keys().get(normalized))) return true;
        String envVar = ENV_VARS.get(normalized);
        return envVar != null && isReal(environment.getProperty(envVar));
    }

    private static boolean isReal(String key) {
        return key != null && !key.isBlank() && !key.contains("placeholder");
    }
}
