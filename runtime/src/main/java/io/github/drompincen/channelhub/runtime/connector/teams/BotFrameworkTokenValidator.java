package io.github.drompincen.channelhub.runtime.connector.teams;

import io.github.drompincen.channelhub.runtime.error.UnauthorizedWebhookException;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import java.util.List;

/**
 * Checks the bearer token Bot Framework attaches to every activity: signature against the published
 * JWKS, expiry, an issuer from the Bot Framework or Azure AD, and the bot's app id as audience.
 */
public class BotFrameworkTokenValidator {

    static final String BOT_FRAMEWORK_ISSUER = "https://api.botframework.com";

    // Azure AD issuers carry the tenant id after the host
    static final List<String> AZURE_AD_ISSUER_PREFIXES = List.of(
            "https://sts.windows.net/",
            "https://login.microsoftonline.com/");

    private final JwtDecoder decoder;

    public static BotFrameworkTokenValidator forJwks(String jwksUri, String appId) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withJwkSetUri(jwksUri).build();
        decoder.setJwtValidator(claimsValidator(appId));
        return new BotFrameworkTokenValidator(decoder);
    }

    public BotFrameworkTokenValidator(JwtDecoder decoder) {
        this.decoder = decoder;
    }

    static OAuth2TokenValidator<Jwt> claimsValidator(String appId) {
        OAuth2TokenValidator<Jwt> issuer = jwt -> {
            String iss = jwt.getIssuer() != null ? jwt.getIssuer().toString() : jwt.getClaimAsString("iss");
            boolean trusted = iss != null && (BOT_FRAMEWORK_ISSUER.equals(iss)
                    || AZURE_AD_ISSUER_PREFIXES.stream().anyMatch(iss::startsWith));
            return trusted ? OAuth2TokenValidatorResult.success()
                    : OAuth2TokenValidatorResult.failure(new OAuth2Error("invalid_token", "Untrusted issuer", null));
        };
        OAuth2TokenValidator<Jwt> audience = jwt -> jwt.getAudience() != null && jwt.getAudience().contains(appId)
                ? OAuth2TokenValidatorResult.success()
                : OAuth2TokenValidatorResult.failure(new OAuth2Error("invalid_token", "Audience mismatch", null));
        return new DelegatingOAuth2TokenValidator<>(new JwtTimestampValidator(), issuer, audience);
    }

    /**
     * @throws UnauthorizedWebhookException if the header is missing, malformed or the token fails a check
     */
    public Jwt validate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith("Bearer ")) {
            throw new UnauthorizedWebhookException("Missing bearer token");
        }
        try {
            return decoder.decode(authorizationHeader.substring("Bearer ".length()).trim());
        } catch (JwtException e) {
            throw new UnauthorizedWebhookException("Bot Framework token rejected: " + e.getMessage(), e);
        }
    }
}
