package io.chime4j.internal.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.chime4j.core.Frequency;
import io.chime4j.core.NotificationType;
import io.chime4j.core.Schedule;
import io.chime4j.core.ScheduleType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoNotificationStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // a Monday
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);
    private static final Instant NINE_PM = Instant.parse("2025-03-10T21:00:00Z");

    private MongoClient mongoClient;
    private MongoTemplate mongoTemplate;

    @BeforeEach
    void setUp() {
        mongoClient = MongoClients.create(MONGO.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(mongoClient, "chime4j_test");
        dropAll();
        mongoTemplate.indexOps(NotificationLedgerDocument.class).ensureIndex(new Index()
                .on("schedulePeriodId", Sort.Direction.ASC)
                .on("type", Sort.Direction.ASC)
                .on("notifyAt", Sort.Direction.ASC)
                .unique()
                .named("ux_period_type_notify_at"));
    }

    @AfterEach
    void tearDown() {
        dropAll();
        mongoClient.close();
    }

    @Test
    void ledgerShouldRecordATripleOnlyOnce() {
        MongoNotificationLedger ledger = new MongoNotificationLedger(mongoTemplate);

        assertFalse(ledger.alreadySent("p-1", NotificationType.BEFORE, NINE_PM));
        assertTrue(ledger.recordSent("p-1", NotificationType.BEFORE, NINE_PM.plusSeconds(12), NINE_PM));
        assertTrue(ledger.alreadySent("p-1", NotificationType.BEFORE, NINE_PM));

        assertFalse(ledger.recordSent("p-1", NotificationType.BEFORE, NINE_PM, NINE_PM.plusSeconds(1)));
        assertTrue(ledger.recordSent("p-1", NotificationType.AFTER, NINE_PM, NINE_PM));
        assertEquals(2, mongoTemplate.count(new Query(), NotificationLedgerDocument.class));
    }

    @Test
    void storeShouldReturnOnlyCandidatesForTheDay() {
        mongoTemplate.insert(doc("daily", "daily", null, TODAY.minusDays(9), null, true));
        mongoTemplate.insert(doc("weekly-mon", "weekly", List.of("monday", "friday"), TODAY.minusDays(9), null, true));
        mongoTemplate.insert(doc("weekly-tue", "weekly", List.of("tuesday"), TODAY.minusDays(9), null, true));
        mongoTemplate.insert(doc("ended", "daily", null, TODAY.minusDays(9), TODAY.minusDays(1), true));
        mongoTemplate.insert(doc("ends-today", "daily", null, TODAY.minusDays(9), TODAY, true));
        mongoTemplate.insert(doc("future", "daily", null, TODAY.plusDays(1), null, true));
        mongoTemplate.insert(doc("inactive", "daily", null, TODAY.minusDays(9), null, false));
        mongoTemplate.insert(doc("once", null, null, TODAY.minusDays(9), null, true));

        List<String> ids = new MongoScheduleStore(mongoTemplate).findCandidates(TODAY).stream()
                .map(Schedule::id)
                .sorted()
                .toList();

        assertEquals(List.of("daily", "ends-today", "weekly-mon"), ids);
    }

    @Test
    void storedDocumentShouldMapToTheEngineModel() {
        ScheduleDocument doc = doc("s-1", "weekly", List.of("monday"), TODAY.minusDays(9), null, true);
        doc.setScheduleType("appointment");
        doc.setSchedulableType("user");
        doc.setSchedulableId("u-1");
        doc.setSchedulableName("Ada");
        doc.setNotifyBefore(true);
        doc.setBeforeNotificationTime(30);
        doc.setBeforeNotificationClass("chime.starting");
        doc.setBeforeNotificationData(Map.of("constructor_params", Map.of("title", "Stand-up")));
        doc.setNotifyAfter(true);
        doc.setAfterNotificationTime(List.of(5, 15));
        mongoTemplate.insert(doc);

        Schedule schedule = new MongoScheduleStore(mongoTemplate).findCandidates(TODAY).get(0);

        assertEquals(ScheduleType.APPOINTMENT, schedule.scheduleType());
        assertEquals(Frequency.WEEKLY, schedule.frequency());
        assertEquals("Ada", schedule.schedulable().name());
        assertEquals(List.of(30), schedule.beforeHook().offsets());
        assertEquals(Map.of("title", "Stand-up"), schedule.beforeHook().constructorParams());
        assertEquals(List.of(5, 15), schedule.afterHook().offsets());
        assertNull(schedule.afterHook().factoryName());
        assertEquals(LocalTime.of(22, 0), schedule.periods().get(0).startTime());
    }

    @Test
    void tickLockShouldExcludeOtherOwnersUntilReleasedOrExpired() {
        Clock clock = Clock.fixed(NINE_PM, ZoneOffset.UTC);
        MongoTickLock lock = new MongoTickLock(mongoTemplate, clock);

        assertTrue(lock.tryAcquire("chime.notify", "worker-A", Duration.ofSeconds(55)));
        assertFalse(lock.tryAcquire("chime.notify", "worker-B", Duration.ofSeconds(55)));
        assertTrue(lock.tryAcquire("chime.notify", "worker-A", Duration.ofSeconds(55)));

        lock.release("chime.notify", "worker-A");
        assertTrue(lock.tryAcquire("chime.notify", "worker-B", Duration.ofSeconds(55)));

        MongoTickLock later = new MongoTickLock(mongoTemplate, Clock.fixed(NINE_PM.plusSeconds(60), ZoneOffset.UTC));
        assertTrue(later.tryAcquire("chime.notify", "worker-C", Duration.ofSeconds(55)));
    }

    private static ScheduleDocument doc(String id, String frequency, List<String> days,
                                        LocalDate start, LocalDate end, boolean active) {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId(id);
        doc.setName("Schedule " + id);
        doc.setStartDate(start);
        doc.setEndDate(end);
        doc.setActive(active);
        doc.setRecurring(frequency != null);
        doc.setFrequency(frequency);
        doc.setFrequencyConfig(days == null ? null : Map.of("days", days));
        doc.setPeriods(List.of(new SchedulePeriodDocument("p-" + id, "22:00", "23:59")));
        return doc;
    }

    private void dropAll() {
        mongoTemplate.dropCollection(ScheduleDocument.class);
        mongoTemplate.dropCollection(NotificationLedgerDocument.class);
        mongoTemplate.dropCollection(TickLockDocument.class);
    }
}
