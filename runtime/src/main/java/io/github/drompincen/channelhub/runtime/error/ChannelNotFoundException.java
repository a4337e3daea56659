package io.github.drompincen.channelhub.runtime.error;

public class ChannelNotFoundException extends ChannelException {

    public ChannelNotFoundException(String message) {
        super("not_found", message);
    }

    public static ChannelNotFoundException account(String tenantId, String accountId) {
        return new ChannelNotFoundException("Channel account " + accountId + " not found for tenant " + tenantId);
    }
}
