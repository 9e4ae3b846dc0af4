package io.dispatch4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Posting schedule of a tenant. Times are stored as {@code HH:mm} strings.
 */
@Document(collection = "posting_schedules")
public class PostingScheduleDocument {

    @Id
    private String id;

    private String tenantId;
    private List<DayOfWeek> activeDays;
    private List<String> postingTimes;
    private boolean active;

    public PostingScheduleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public List<DayOfWeek> getActiveDays() {
        return activeDays;
    }

    public void setActiveDays(List<DayOfWeek> activeDays) {
        this.activeDays = activeDays;
    }

    public List<String> getPostingTimes() {
        return postingTimes;
    }

    public void setPostingTimes(List<String> postingTimes) {
        this.postingTimes = postingTimes;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
