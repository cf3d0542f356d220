package com.flagship.savings_circle.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Notification rows. One row per (source event, user): writing the same one
 * again is a no-op, whichever consumer instance gets there first.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class NotificationStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * @return true if a new row was written
     */
    @Transactional
    public boolean save(UUID userId, NotificationType type, String title, String message,
                        UUID relatedGroupId, UUID sourceEventId) {
        int inserted = jdbcTemplate.update("""
            INSERT INTO notifications (id, user_id, type, title, message, related_group_id,
                source_event_id, is_read, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, FALSE, ?)
            ON CONFLICT (source_event_id, user_id) DO NOTHING
            """,
            UUID.randomUUID(), userId, type.name(), title, message, relatedGroupId, sourceEventId,
            Timestamp.from(clock.instant()));
        if (inserted == 0) {
            log.debug("Notification for event {} and user {} already exists", sourceEventId, userId);
        }
        return inserted == 1;
    }

    @Transactional(readOnly = true)
    public List<Notification> findForUser(UUID userId) {
        return jdbcTemplate.query("""
            SELECT id, user_id, type, title, message, related_group_id, source_event_id, is_read, created_at
            FROM notifications
            WHERE user_id = ?
            ORDER BY created_at DESC, id
            """, rowMapper(), userId);
    }

    @Transactional(readOnly = true)
    public List<Notification> findBySourceEvent(UUID sourceEventId) {
        return jdbcTemplate.query("""
            SELECT id, user_id, type, title, message, related_group_id, source_event_id, is_read, created_at
            FROM notifications
            WHERE source_event_id = ?
            ORDER BY user_id
            """, rowMapper(), sourceEventId);
    }

    private RowMapper<Notification> rowMapper() {
        return (rs, rowNum) -> new Notification(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            NotificationType.valueOf(rs.getString("type")),
            rs.getString("title"),
            rs.getString("message"),
            rs.getObject("related_group_id", UUID.class),
            rs.getObject("source_event_id", UUID.class),
            rs.getBoolean("is_read"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
