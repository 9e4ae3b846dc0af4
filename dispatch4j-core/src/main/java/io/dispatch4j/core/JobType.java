package io.dispatch4j.core;

/**
 * Closed set of background job types. Every member must have exactly one payload
 * schema in {@link io.dispatch4j.payload.PayloadSchemas}.
 */
public enum JobType {
    SCRAPE_WEBSITE,
    SYNC_RSS,
    PROCESS_DOCUMENT,
    GENERATE_CONTENT,
    GENERATE_IMAGE,
    PUBLISH_CONTENT,
    SYNC_ANALYTICS,
    REFRESH_TOKEN
}
