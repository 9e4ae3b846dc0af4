package io.dispatch4j.testing;

import io.dispatch4j.publishing.ContentStatus;
import io.dispatch4j.publishing.ScheduledContent;
import io.dispatch4j.publishing.Variation;
import io.dispatch4j.publishing.VariationStatus;
import io.dispatch4j.spi.ContentStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class InMemoryContentStore implements ContentStore {

    private final Map<String, ScheduledContent> units = new LinkedHashMap<>();

    public synchronized void save(ScheduledContent content) {
        units.put(content.id(), content);
    }

    public synchronized ScheduledContent get(String contentId) {
        return units.get(contentId);
    }

    public synchronized Variation variation(String variationId) {
        return findByVariationId(variationId)
                .flatMap(c -> c.variations().stream().filter(v -> v.id().equals(variationId)).findFirst())
                .orElse(null);
    }

    @Override
    public synchronized List<ScheduledContent> findDue(Instant now) {
        return units.values().stream()
                .filter(c -> c.status() == ContentStatus.SCHEDULED)
                .filter(c -> c.approval() != null && c.approval().isApproved())
                .filter(c -> c.scheduledFor() != null && !c.scheduledFor().isAfter(now))
                .toList();
    }

    @Override
    public synchronized Optional<ScheduledContent> findById(String contentId) {
        return Optional.ofNullable(units.get(contentId));
    }

    @Override
    public synchronized Optional<ScheduledContent> findByVariationId(String variationId) {
        return units.values().stream()
                .filter(c -> c.variations().stream().anyMatch(v -> v.id().equals(variationId)))
                .findFirst();
    }

    @Override
    public synchronized void updateStatus(String contentId, ContentStatus status, Instant publishedAt, String error) {
        ScheduledContent c = units.get(contentId);
        units.put(contentId, new ScheduledContent(c.id(), c.tenantId(), c.brandId(), c.body(), c.mediaUrls(),
                c.scheduledFor(), c.approval(), status, publishedAt != null ? publishedAt : c.publishedAt(), error,
                c.variations()));
    }

    @Override
    public void markVariationPublishing(String variationId) {
        updateVariation(variationId, v -> withStatus(v, VariationStatus.PUBLISHING, v.postId(), v.postUrl(), v.publishedAt(), v.error()));
    }

    @Override
    public void markVariationPublished(String variationId, String postId, String postUrl, Instant publishedAt) {
        updateVariation(variationId, v -> withStatus(v, VariationStatus.PUBLISHED, postId, postUrl, publishedAt, null));
    }

    @Override
    public void markVariationScheduled(String variationId, String error) {
        updateVariation(variationId, v -> withStatus(v, VariationStatus.SCHEDULED, v.postId(), v.postUrl(), v.publishedAt(), error));
    }

    @Override
    public void markVariationFailed(String variationId, String error) {
        updateVariation(variationId, v -> withStatus(v, VariationStatus.FAILED, v.postId(), v.postUrl(), v.publishedAt(), error));
    }

    @Override
    public synchronized List<Instant> findScheduledSlots(String brandId, Instant from, Instant to) {
        return units.values().stream()
                .filter(c -> c.brandId().equals(brandId) && c.status() == ContentStatus.SCHEDULED)
                .map(ScheduledContent::scheduledFor)
                .filter(t -> t != null && !t.isBefore(from) && !t.isAfter(to))
                .toList();
    }

    @Override
    public synchronized boolean assignSchedule(String tenantId, String contentId, Instant slot) {
        ScheduledContent c = units.get(contentId);
        if (c == null || !c.tenantId().equals(tenantId)) {
            return false;
        }
        List<Variation> variations = new ArrayList<>();
        for (Variation v : c.variations()) {
            boolean promote = v.status() == VariationStatus.PENDING || v.status() == VariationStatus.APPROVED;
            variations.add(promote ? withStatus(v, VariationStatus.SCHEDULED, v.postId(), v.postUrl(), v.publishedAt(), v.error()) : v);
        }
        units.put(contentId, new ScheduledContent(c.id(), c.tenantId(), c.brandId(), c.body(), c.mediaUrls(),
                slot, c.approval(), ContentStatus.SCHEDULED, c.publishedAt(), c.error(), variations));
        return true;
    }

    private synchronized void updateVariation(String variationId, UnaryOperator<Variation> change) {
        ScheduledContent c = findByVariationId(variationId).orElseThrow();
        List<Variation> variations = new ArrayList<>();
        for (Variation v : c.variations()) {
            variations.add(v.id().equals(variationId) ? change.apply(v) : v);
        }
        units.put(c.id(), new ScheduledContent(c.id(), c.tenantId(), c.brandId(), c.body(), c.mediaUrls(),
                c.scheduledFor(), c.approval(), c.status(), c.publishedAt(), c.error(), variations));
    }

    private static Variation withStatus(Variation v, VariationStatus status, String postId, String postUrl,
                                        Instant publishedAt, String error) {
        return new Variation(v.id(), v.contentId(), v.platform(), v.accountId(), v.text(), v.mediaUrl(), status,
                postId, postUrl, publishedAt, error);
    }
}
