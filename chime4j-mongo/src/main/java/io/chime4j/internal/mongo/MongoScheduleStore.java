package io.chime4j.internal.mongo;

import io.chime4j.core.Frequency;
import io.chime4j.core.NotificationHook;
import io.chime4j.core.Schedulable;
import io.chime4j.core.Schedule;
import io.chime4j.core.SchedulePeriod;
import io.chime4j.core.ScheduleType;
import io.chime4j.spi.ScheduleStore;
import io.chime4j.utils.OffsetCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads schedules from the {@code schedules} collection.
 *
 * <p>Frequencies are stored lower-cased ("daily", "weekly"); weekly schedules list their weekdays
 * under {@code frequencyConfig.days}.
 */
public class MongoScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<Schedule> findCandidates(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");

        List<ScheduleDocument> docs = mongoTemplate.find(candidateQuery(date), ScheduleDocument.class);
        List<Schedule> schedules = new ArrayList<>(docs.size());
        for (ScheduleDocument doc : docs) {
            try {
                schedules.add(toSchedule(doc));
            } catch (RuntimeException e) {
                // one malformed schedule must not hide the others
                log.error("chime skipping unreadable schedule id={} msg={}", doc.getId(), e.getMessage(), e);
            }
        }
        return schedules;
    }

    /**
     * Active schedules within date bounds on {@code date} that recur daily, or weekly on its weekday.
     */
    static Query candidateQuery(LocalDate date) {
        String weekday = Frequency.weekdayName(date);
        return new Query(new Criteria().andOperator(
                Criteria.where("active").is(true),
                Criteria.where("startDate").lte(date),
                new Criteria().orOperator(
                        Criteria.where("endDate").is(null),
                        Criteria.where("endDate").gte(date)
                ),
                new Criteria().orOperator(
                        Criteria.where("frequency").is(value(Frequency.DAILY)),
                        Criteria.where("frequency").is(value(Frequency.WEEKLY))
                                .and("frequencyConfig." + Frequency.DAYS_KEY).is(weekday)
                )
        ));
    }

    /**
     * Converts a persisted {@link ScheduleDocument} into the engine's read-only {@link Schedule}.
     */
    public Schedule toSchedule(ScheduleDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");

        Schedulable owner = doc.getSchedulableId() == null
                ? null
                : new Schedulable(doc.getSchedulableType() == null ? "unknown" : doc.getSchedulableType(),
                        doc.getSchedulableId(), doc.getSchedulableName());

        List<SchedulePeriod> periods = new ArrayList<>();
        if (doc.getPeriods() != null) {
            for (SchedulePeriodDocument p : doc.getPeriods()) {
                periods.add(new SchedulePeriod(p.getId(), LocalTime.parse(p.getStartTime()), LocalTime.parse(p.getEndTime())));
            }
        }

        return new Schedule(
                doc.getId(),
                doc.getName(),
                doc.getDescription(),
                owner,
                doc.getScheduleType() == null ? null : ScheduleType.valueOf(doc.getScheduleType().toUpperCase(Locale.ROOT)),
                doc.getStartDate(),
                doc.getEndDate(),
                doc.isRecurring(),
                Frequency.fromValue(doc.getFrequency()),
                doc.getFrequencyConfig(),
                doc.isActive(),
                hook(doc.isNotifyBefore(), doc.getBeforeNotificationTime(), doc.getBeforeNotificationClass(), doc.getBeforeNotificationData()),
                hook(doc.isNotifyAfter(), doc.getAfterNotificationTime(), doc.getAfterNotificationClass(), doc.getAfterNotificationData()),
                periods
        );
    }

    private static NotificationHook hook(boolean enabled, Object time, String factoryName, Map<String, Object> data) {
        return new NotificationHook(enabled, OffsetCalculator.normalize(time), factoryName, data);
    }

    private static String value(Frequency frequency) {
        return frequency.name().toLowerCase(Locale.ROOT);
    }
}
