package io.github.drompincen.channelhub.runtime.agent;

/** Answers whether a tenant has a usable API key for an upstream model provider. */
public interface ApiKeyLookup {

    boolean hasKey(String tenantId, String provider);
}
