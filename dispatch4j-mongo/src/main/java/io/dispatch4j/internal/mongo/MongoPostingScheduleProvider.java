package io.dispatch4j.internal.mongo;

import io.dispatch4j.publishing.PostingSchedule;
import io.dispatch4j.spi.PostingScheduleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Reads tenant posting schedules from {@code posting_schedules}. Times are stored as
 * {@code HH:mm} strings; an unparsable time is logged and skipped.
 */
public class MongoPostingScheduleProvider implements PostingScheduleProvider {
    private static final Logger log = LoggerFactory.getLogger(MongoPostingScheduleProvider.class);

    private final MongoTemplate mongoTemplate;

    public MongoPostingScheduleProvider(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<PostingSchedule> activeSchedules(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Query q = new Query(Criteria.where("tenantId").is(tenantId).and("active").is(true));

        List<PostingSchedule> out = new ArrayList<>();
        for (PostingScheduleDocument doc : mongoTemplate.find(q, PostingScheduleDocument.class)) {
            List<LocalTime> times = new ArrayList<>();
            if (doc.getPostingTimes() != null) {
                for (String t : doc.getPostingTimes()) {
                    try {
                        times.add(LocalTime.parse(t));
                    } catch (DateTimeParseException e) {
                        log.warn("skipping invalid posting time scheduleId={} time={}", doc.getId(), t);
                    }
                }
            }
            EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
            if (doc.getActiveDays() != null) {
                days.addAll(doc.getActiveDays());
            }
            out.add(new PostingSchedule(doc.getTenantId(), days, times, true));
        }
        return out;
    }
}
