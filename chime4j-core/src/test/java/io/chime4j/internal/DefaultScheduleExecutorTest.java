package io.chime4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chime4j.NotificationSender;
import io.chime4j.core.BatchOutcome;
import io.chime4j.core.NotificationFactoryRegistry;
import io.chime4j.core.NotificationHook;
import io.chime4j.core.NotificationSettings;
import io.chime4j.core.Schedulable;
import io.chime4j.core.Schedule;
import io.chime4j.notification.BuiltInNotificationFactories;
import io.chime4j.notification.ChannelPayload;
import io.chime4j.notification.Notification;
import io.chime4j.notification.NotificationChannel;
import io.chime4j.notification.ScheduleCompletedNotification;
import io.chime4j.notification.ScheduleStartingNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class DefaultScheduleExecutorTest {

    private static final Schedulable OWNER = new Schedulable("user", "u-1", "Ada");

    private NotificationSender sender;
    private Clock clock;

    @BeforeEach
    void setUp() {
        sender = mock(NotificationSender.class);
        clock = Clock.fixed(Instant.parse("2025-03-10T10:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void successShouldSendBeforeThenCompletedAfter() throws Exception {
        DefaultScheduleExecutor executor = executor(NotificationSettings.defaults());

        String result = executor.execute(schedule("s-1"), s -> "done:" + s.id());

        assertEquals("done:s-1", result);
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(sender, times(2)).sendQueued(any(), captor.capture());

        assertInstanceOf(ScheduleStartingNotification.class, captor.getAllValues().get(0));
        ScheduleCompletedNotification after = assertInstanceOf(ScheduleCompletedNotification.class, captor.getAllValues().get(1));
        Map<?, ?> details = (Map<?, ?>) after.renderFor(NotificationChannel.DATABASE, OWNER).get("execution_details");
        assertEquals("completed", details.get("status"));
        assertTrue(details.containsKey("completed_at"));
    }

    @Test
    void failureShouldSendFailedDetailsAndRethrow() {
        DefaultScheduleExecutor executor = executor(NotificationSettings.defaults());
        IllegalStateException boom = new IllegalStateException("disk full");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> executor.execute(schedule("s-1"), s -> {
                    throw boom;
                }));

        assertSame(boom, thrown);
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(sender, times(2)).sendQueued(any(), captor.capture());
        ChannelPayload payload = captor.getAllValues().get(1).renderFor(NotificationChannel.DATABASE, OWNER);
        Map<?, ?> details = (Map<?, ?>) payload.get("execution_details");
        assertEquals("failed", details.get("status"));
        assertEquals("disk full", details.get("error"));
        assertTrue(details.containsKey("failed_at"));
    }

    @Test
    void nullTaskShouldOnlySendNotifications() throws Exception {
        DefaultScheduleExecutor executor = executor(NotificationSettings.defaults());

        assertNull(executor.execute(schedule("s-1")));
        verify(sender, times(2)).sendQueued(any(), any());
    }

    @Test
    void beforeDeliveryFailureShouldNotStopTheWork() throws Exception {
        doThrow(new IllegalStateException("queue down"))
                .doNothing()
                .when(sender).sendQueued(any(), any());
        DefaultScheduleExecutor executor = executor(NotificationSettings.defaults());

        Integer result = executor.execute(schedule("s-1"), s -> 42);

        assertEquals(42, result);
        verify(sender, times(2)).sendQueued(any(), any());
    }

    @Test
    void disabledNotificationsShouldStillRunTheWork() throws Exception {
        DefaultScheduleExecutor executor = executor(NotificationSettings.defaults().withEnabled(false));

        assertEquals("ok", executor.execute(schedule("s-1"), s -> "ok"));
        verifyNoInteractions(sender);
    }

    @Test
    void batchShouldRecordEveryScheduleIndependently() {
        DefaultScheduleExecutor executor = executor(NotificationSettings.defaults());
        List<Schedule> schedules = List.of(schedule("a"), schedule("b"), schedule("c"));

        Map<String, BatchOutcome<String>> results = executor.executeBatch(schedules, s -> {
            if (s.id().equals("b")) {
                throw new IllegalArgumentException("bad input");
            }
            return s.id().toUpperCase();
        });

        assertEquals(List.of("a", "b", "c"), List.copyOf(results.keySet()));
        assertEquals(BatchOutcome.success("A"), results.get("a"));
        assertEquals(BatchOutcome.failed("bad input"), results.get("b"));
        assertEquals(BatchOutcome.success("C"), results.get("c"));
        verify(sender, times(6)).sendQueued(any(), any());
    }

    @Test
    void batchErrorWithoutMessageShouldUseTheExceptionType() {
        DefaultScheduleExecutor executor = executor(NotificationSettings.defaults().withEnabled(false));

        Map<String, BatchOutcome<Object>> results = executor.executeBatch(List.of(schedule("a")), s -> {
            throw new UnsupportedOperationException();
        });

        assertEquals(UnsupportedOperationException.class.getName(), results.get("a").error());
    }

    private DefaultScheduleExecutor executor(NotificationSettings settings) {
        NotificationFactoryRegistry registry = new NotificationFactoryRegistry(
                BuiltInNotificationFactories.all(settings), new ObjectMapper());
        return new DefaultScheduleExecutor(new NotificationDispatcher(registry, sender, settings), clock);
    }

    private static Schedule schedule(String id) {
        return Schedule.builder(id)
                .name("Backup " + id)
                .schedulable(OWNER)
                .from(LocalDate.of(2025, 3, 1))
                .daily()
                .notifyBefore(new NotificationHook(true, List.of(10), ScheduleStartingNotification.NAME, Map.of()))
                .notifyAfter(new NotificationHook(true, List.of(5), ScheduleCompletedNotification.NAME, Map.of()))
                .build();
    }
}
