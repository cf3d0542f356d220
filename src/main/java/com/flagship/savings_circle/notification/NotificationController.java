package com.flagship.savings_circle.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationStore notificationStore;

    @GetMapping("/api/users/{userId}/notifications")
    public ResponseEntity<List<Notification>> getNotifications(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(notificationStore.findForUser(userId));
    }
}
