package io.dispatch4j.payload;

import io.dispatch4j.core.JobType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps every {@link JobType} to the record its payload must convert to.
 */
public final class PayloadSchemas {

    private PayloadSchemas() {
    }

    public static Map<JobType, Class<? extends JobPayload>> defaults() {
        Map<JobType, Class<? extends JobPayload>> schemas = new EnumMap<>(JobType.class);
        schemas.put(JobType.SCRAPE_WEBSITE, ContextScrapingPayload.class);
        schemas.put(JobType.SYNC_RSS, ContextScrapingPayload.class);
        schemas.put(JobType.PROCESS_DOCUMENT, DocumentProcessingPayload.class);
        schemas.put(JobType.GENERATE_CONTENT, ContentGenerationPayload.class);
        schemas.put(JobType.GENERATE_IMAGE, ImageGenerationPayload.class);
        schemas.put(JobType.PUBLISH_CONTENT, ContentPublishingPayload.class);
        schemas.put(JobType.SYNC_ANALYTICS, AnalyticsSyncPayload.class);
        schemas.put(JobType.REFRESH_TOKEN, TokenRefreshPayload.class);
        return Collections.unmodifiableMap(schemas);
    }
}
