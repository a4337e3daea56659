package io.github.drompincen.channelhub.runtime.channel;

/**
 * Connectors whose accounts are installed through an OAuth authorization-code flow.
 * These methods use the application's client credentials and need no connected state.
 */
public interface OAuthCapable {

    String authorizationUrl(String state, String redirectUri);

    OAuthCredentials exchangeCode(String code, String redirectUri);

    OAuthCredentials refresh(String refreshToken);
}
