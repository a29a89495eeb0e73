package io.chime4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chime4j.NotificationFactory;
import io.chime4j.NotificationScheduler;
import io.chime4j.NotificationSender;
import io.chime4j.ScheduleExecutor;
import io.chime4j.core.NotificationFactoryRegistry;
import io.chime4j.core.NotificationSettings;
import io.chime4j.internal.DefaultScheduleExecutor;
import io.chime4j.internal.LoggingNotificationSender;
import io.chime4j.internal.MinuteNotificationScheduler;
import io.chime4j.internal.NotificationDispatcher;
import io.chime4j.internal.NotificationTick;
import io.chime4j.internal.RecurrenceMatcher;
import io.chime4j.internal.mongo.MongoNotificationLedger;
import io.chime4j.internal.mongo.MongoScheduleStore;
import io.chime4j.internal.mongo.MongoTickLock;
import io.chime4j.notification.BuiltInNotificationFactories;
import io.chime4j.spi.NotificationLedger;
import io.chime4j.spi.ScheduleStore;
import io.chime4j.spi.TickLock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for schedule notifications.
 *
 * <p>Applications usually only provide a {@link NotificationSender} and their own
 * {@link NotificationFactory} beans; everything else has a Mongo-backed default.
 */
@AutoConfiguration
@ConditionalOnClass({NotificationScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(ChimeProperties.class)
@ConditionalOnProperty(prefix = "chime", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChimeConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock chimeClock(ChimeProperties props) {
        String tz = props.getTimezone();
        return tz == null || tz.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(tz));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore(MongoTemplate mongoTemplate) {
        return new MongoScheduleStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationLedger notificationLedger(MongoTemplate mongoTemplate) {
        return new MongoNotificationLedger(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TickLock tickLock(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoTickLock(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected ChimeMongoIndexConfig chimeMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new ChimeMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSender notificationSender() {
        return new LoggingNotificationSender();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationFactoryRegistry notificationFactoryRegistry(NotificationSettings settings,
                                                                   ObjectProvider<List<NotificationFactory<?>>> factoriesProvider,
                                                                   ObjectProvider<ObjectMapper> objectMapperProvider) {
        List<NotificationFactory<?>> factories = new ArrayList<>(BuiltInNotificationFactories.all(settings));
        factories.addAll(factoriesProvider.getIfAvailable(List::of));
        return new NotificationFactoryRegistry(factories, objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(NotificationFactoryRegistry registry,
                                                         NotificationSender sender,
                                                         NotificationSettings settings) {
        return new NotificationDispatcher(registry, sender, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationTick notificationTick(ScheduleStore store,
                                             NotificationDispatcher dispatcher,
                                             NotificationLedger ledger,
                                             TickLock tickLock,
                                             Clock clock,
                                             ChimeProperties props) {
        return new NotificationTick(
                new RecurrenceMatcher(store, clock.getZone()),
                dispatcher,
                ledger,
                tickLock,
                clock,
                WorkerIds.resolve(props.getWorkerId()),
                props.getTickLockLifetime()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationScheduler notificationScheduler(NotificationTick tick, Clock clock, ChimeProperties props) {
        return new MinuteNotificationScheduler(tick, props.getTickEvery(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleExecutor scheduleExecutor(NotificationDispatcher dispatcher, Clock clock) {
        return new DefaultScheduleExecutor(dispatcher, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChimeLifecycle chimeLifecycle(NotificationScheduler scheduler, ChimeProperties props) {
        return new ChimeLifecycle(scheduler, props.isAutoStart());
    }

    @Bean
    @ConditionalOnProperty(prefix = "chime", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton chimeIndexesInitializer(ChimeMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSettings notificationSettings(ChimeProperties props) {
        return props.toSettings();
    }
}
