package io.github.drompincen.channelhub.runtime.agent;

import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the model a channel talks to: the account's own {@code model} setting when it is not "auto",
 * else the first provider in priority order the tenant holds a key for, else the configured fallback.
 */
@Component
public class ModelSelector {

    static final List<ModelSelection> PRIORITY = List.of(
            new ModelSelection("anthropic", "claude-sonnet-4-20250514"),
            new ModelSelection("openai", "gpt-4o"),
            new ModelSelection("google", "gemini-2.0-flash"),
            new ModelSelection("xai", "grok-2"),
            new ModelSelection("openrouter", "anthropic/claude-3.5-sonnet"));

    private final ApiKeyLookup apiKeys;
    private final ChannelHubProperties.Models models;

    public ModelSelector(ApiKeyLookup apiKeys, ChannelHubProperties properties) {
        this.apiKeys = apiKeys;
        this.models = properties.models();
    }

    /**
     * @throws CredentialMissingException if nothing is configured and no fallback is set
     */
    public ModelSelection select(String tenantId, Map<String, Object> accountConfig) {
        Optional<ModelSelection> explicit = explicit(accountConfig);
        if (explicit.isPresent()) return explicit.get();

        for (ModelSelection candidate : PRIORITY) {
            if (apiKeys.hasKey(tenantId, candidate.provider())) return candidate;
        }

        if (isSet(models.fallbackProvider()) && isSet(models.fallbackModel())) {
            return new ModelSelection(models.fallbackProvider(), models.fallbackModel());
        }
        throw new CredentialMissingException("No upstream model API key is configured for tenant " + tenantId);
    }

    /** The model pinned in an account's config, if any. */
    public Optional<ModelSelection> explicit(Map<String, Object> accountConfig) {
        if (accountConfig == null) return Optional.empty();
        Object model = accountConfig.get("model");
        if (model == null || String.valueOf(model).isBlank() || "auto".equals(model)) return Optional.empty();
        String modelId = String.valueOf(model);
        Object provider = accountConfig.get("provider");
        String resolvedProvider = provider != null && !String.valueOf(provider).isBlank()
                ? String.valueOf(provider) : detectProvider(modelId);
        return Optional.of(new ModelSelection(resolvedProvider, modelId));
    }

    public static String detectProvider(String modelId) {
        if (modelId.startsWith("ollama/")) return "ollama";
        if (modelId.startsWith("lmstudio/")) return "lmstudio";
        if (modelId.contains("claude")) return "anthropic";
        if (modelId.contains("gpt") || modelId.contains("o1") || modelId.contains("o3")) return "openai";
        if (modelId.contains("gemini")) return "google";
        if (modelId.contains("grok")) return "xai";
        return "openrouter";
    }

    private static boolean isSet(String s) {
        return s != null && !s.isBlank();
    }
}
