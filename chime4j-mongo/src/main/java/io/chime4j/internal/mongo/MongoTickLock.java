package io.chime4j.internal.mongo;

import io.chime4j.spi.TickLock;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cross-instance tick lock in the {@code chime_locks} collection.
 *
 * <p>A lease is claimed atomically via {@code findAndModify} with upsert. It is free when it does not
 * exist, has expired ({@code lockUntil <= now}) or is already held by the same owner. When another
 * owner holds it, the upsert collides on {@code _id} and the claim fails.
 */
public class MongoTickLock implements TickLock {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoTickLock(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean tryAcquire(String name, String owner, Duration lifetime) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(lifetime, "lifetime must not be null");
        if (lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException("lifetime must be a positive duration");
        }

        Instant now = clock.instant();
        Query free = new Query(Criteria.where("_id").is(name).orOperator(
                Criteria.where("lockUntil").is(null),
                Criteria.where("lockUntil").lte(now),
                Criteria.where("lockedBy").is(owner)
        ));
        Update claim = new Update()
                .set("lockedBy", owner)
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lifetime));

        try {
            TickLockDocument doc = mongoTemplate.findAndModify(free, claim,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), TickLockDocument.class);
            return doc != null && owner.equals(doc.getLockedBy());
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public void release(String name, String owner) {
        Query held = new Query(Criteria.where("_id").is(name).and("lockedBy").is(owner));
        Update free = new Update()
                .unset("lockedBy")
                .unset("lockedAt")
                .unset("lockUntil");
        mongoTemplate.updateFirst(held, free, TickLockDocument.class);
    }
}
