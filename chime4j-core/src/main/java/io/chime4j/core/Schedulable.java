package io.chime4j.core;

import java.util.Objects;

/**
 * Reference to the entity owning a schedule, and the addressee of its notifications.
 *
 * @param type owner kind, e.g. "user" or "room"
 * @param id   owner identifier
 * @param name display name used in greetings; may be null
 */
public record Schedulable(String type, String id, String name) {

    public Schedulable {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(id, "id must not be null");
    }

    public static Schedulable of(String type, String id) {
        return new Schedulable(type, id, null);
    }
}
