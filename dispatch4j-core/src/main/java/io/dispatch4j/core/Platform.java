package io.dispatch4j.core;

/**
 * Social platforms content can be published to.
 *
 * <p>{@link #defaultHourlyLimit()} is the number of publish calls admitted per tenant
 * in one rate-limit window; {@link #characterLimit()} is the maximum text length, or
 * {@code 0} when the platform does not enforce one here.
 */
public enum Platform {
    TWITTER(50, 280),
    LINKEDIN(100, 3000),
    FACEBOOK(200, 63206),
    INSTAGRAM(25, 2200),
    TIKTOK(30, 0),
    YOUTUBE(10, 0),
    THREADS(50, 0),
    BLUESKY(50, 0);

    private final int defaultHourlyLimit;
    private final int characterLimit;

    Platform(int defaultHourlyLimit, int characterLimit) {
        this.defaultHourlyLimit = defaultHourlyLimit;
        this.characterLimit = characterLimit;
    }

    public int defaultHourlyLimit() {
        return defaultHourlyLimit;
    }

    public int characterLimit() {
        return characterLimit;
    }

    public boolean exceedsCharacterLimit(String text) {
        return characterLimit > 0 && text != null && text.length() > characterLimit;
    }
}
