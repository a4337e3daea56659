package io.github.drompincen.channelhub.runtime.processor;

public record ProcessingResult(Status status, String conversationId, String responseMessageId, String error) {

    public enum Status { REPLIED, SKIPPED, RATE_LIMITED, FAILED }

    public static ProcessingResult replied(String conversationId, String responseMessageId) {
        return new ProcessingResult(Status.REPLIED, conversationId, responseMessageId, null);
    }

    public static ProcessingResult skipped(String reason) {
        return new ProcessingResult(Status.SKIPPED, null, null, reason);
    }

    public static ProcessingResult rateLimited() {
        return new ProcessingResult(Status.RATE_LIMITED, null, null, "rate_limited");
    }

    public static ProcessingResult failed(String conversationId, String error) {
        return new ProcessingResult(Status.FAILED, conversationId, null, error);
    }
}
