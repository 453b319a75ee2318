package com.autonomous.content.notification;

import com.autonomous.content.model.NotificationEvent;

import java.util.Map;

/**
 * Outbound notifications. Implementations must not throw; delivery is best effort.
 */
public interface Notifier {

    void notify(String organizationId, NotificationEvent event, Map<String, Object> payload);
}
