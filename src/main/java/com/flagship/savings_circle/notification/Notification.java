package com.flagship.savings_circle.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * In-app message for one user. {@code sourceEventId} ties it to the event that produced it.
 */
@Value
public class Notification {
    UUID id;
    UUID userId;
    NotificationType type;
    String title;
    String message;
    UUID relatedGroupId;
    UUID sourceEventId;
    boolean read;
    Instant createdAt;
}
