package io.dispatch4j.publishing;

public record PublishResult(boolean success, String postId, String postUrl, String error) {

    public static PublishResult published(String postId, String postUrl) {
        return new PublishResult(true, postId, postUrl, null);
    }

    public static PublishResult failed(String error) {
        return new PublishResult(false, null, null, error == null ? "Unknown error" : error);
    }
}
