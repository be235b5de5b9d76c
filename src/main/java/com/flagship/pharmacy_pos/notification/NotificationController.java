package com.flagship.pharmacy_pos.notification;

import com.flagship.pharmacy_pos.notification.dto.NotificationResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping("/users/{userId}/notifications")
    public ResponseEntity<List<NotificationResponse>> list(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "unread", defaultValue = "false") boolean unreadOnly) {
        return ResponseEntity.ok(notificationService.findForUser(userId, unreadOnly).stream()
            .map(NotificationResponse::from)
            .toList());
    }

    @PostMapping("/notifications/{notificationId}/read")
    public ResponseEntity<NotificationResponse> markRead(@PathVariable("notificationId") UUID notificationId) {
        return ResponseEntity.ok(NotificationResponse.from(notificationService.markRead(notificationId)));
    }
}
