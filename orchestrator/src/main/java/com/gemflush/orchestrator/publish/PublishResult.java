package com.gemflush.orchestrator.publish;

public record PublishResult(boolean success, String qid, String error) {

    public static PublishResult published(String qid) {
        return new PublishResult(true, qid, null);
    }

    public static PublishResult rejected(String error) {
        return new PublishResult(false, null, error);
    }
}
