package io.chime4j.notification;

public enum NotificationChannel {
    MAIL,
    DATABASE,
    BROADCAST
}
