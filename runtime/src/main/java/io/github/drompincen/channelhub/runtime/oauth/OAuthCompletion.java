package io.github.drompincen.channelhub.runtime.oauth;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.runtime.channel.OAuthCredentials;

/** Outcome of a redeemed callback: the tenant that started the flow and the account it produced. */
public record OAuthCompletion(String tenantId, ChannelAccountDocument account, OAuthCredentials credentials) {}
