package com.lineguard.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import com.google.firebase.messaging.Notification;
import com.lineguard.backend.config.FirestoreConfig;
import com.lineguard.backend.model.ClearedLine;
import com.lineguard.backend.model.Disruption;
import com.lineguard.backend.model.RouteDisruptionMatch;
import com.lineguard.backend.model.RouteSchedule;
import com.lineguard.backend.model.UserRoute;
import com.lineguard.backend.util.TflUtils;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Sends route alerts and status updates to the FCM topic
 * {@code route_<routeId>} that the route owner's devices subscribe to.
 */
@Service
@Slf4j
public class FcmNotificationDispatcher implements NotificationDispatcher {

    @Value("${fcm.service-account-path:}")
    private String serviceAccountPath;

    @Value("${fcm.service-account-json:}")
    private String serviceAccountJson;

    private final ObjectMapper objectMapper;
    private boolean fcmEnabled = false;

    public FcmNotificationDispatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initialize() {
        try {
            GoogleCredentials credentials = FirestoreConfig.loadCredentials(serviceAccountJson, serviceAccountPath);
            if (credentials == null) {
                log.warn("⚠️  FCM service account not configured. Alerts will not be delivered.");
                return;
            }
            if (FirebaseApp.getApps().isEmpty()) {
                FirebaseApp.initializeApp(FirebaseOptions.builder()
                        .setCredentials(credentials)
                        .build());
            }
            fcmEnabled = true;
            log.info("✅ Firebase Cloud Messaging initialized successfully");
        } catch (IOException e) {
            log.error("❌ Failed to initialize Firebase Cloud Messaging", e);
        }
    }

    @Override
    public boolean dispatch(UserRoute route, RouteSchedule schedule, List<RouteDisruptionMatch> matches) {
        if (!fcmEnabled) {
            log.warn("⚠️ [FCM] Disabled, alert for route {} not delivered", route.getId());
            return false;
        }

        String topic = TflUtils.routeTopic(route.getId());
        try {
            Message message = Message.builder()
                    .setTopic(topic)
                    .setNotification(Notification.builder()
                            .setTitle("Disruption on " + route.getName())
                            .setBody(summarize(matches))
                            .build())
                    .putData("payload", objectMapper.writeValueAsString(buildPayload(route, schedule, matches)))
                    .build();
            String messageId = FirebaseMessaging.getInstance().send(message);
            log.info("📤 [FCM] Alert sent to {} ({} disruptions, id {})", topic, matches.size(), messageId);
            return true;
        } catch (JsonProcessingException e) {
            log.error("❌ [FCM] Failed to build payload for topic: {}", topic, e);
            return false;
        } catch (FirebaseMessagingException e) {
            log.error("❌ [FCM] Send error for topic {}: {}", topic, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean dispatchStatusUpdate(UserRoute route, RouteSchedule schedule, List<ClearedLine> clearedLines) {
        if (!fcmEnabled) {
            log.warn("⚠️ [FCM] Disabled, status update for route {} not delivered", route.getId());
            return false;
        }

        String topic = TflUtils.routeTopic(route.getId());
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", "status_update");
            payload.put("routeId", route.getId());
            payload.put("routeName", route.getName());
            payload.put("scheduleId", schedule.getId());
            payload.put("clearedLines", clearedLines);

            Message message = Message.builder()
                    .setTopic(topic)
                    .setNotification(Notification.builder()
                            .setTitle("Service restored on " + route.getName())
                            .setBody(summarizeCleared(clearedLines))
                            .build())
                    .putData("payload", objectMapper.writeValueAsString(payload))
                    .build();
            String messageId = FirebaseMessaging.getInstance().send(message);
            log.info("📤 [FCM] Status update sent to {} ({} lines cleared, id {})",
                    topic, clearedLines.size(), messageId);
            return true;
        } catch (JsonProcessingException e) {
            log.error("❌ [FCM] Failed to build status update for topic: {}", topic, e);
            return false;
        } catch (FirebaseMessagingException e) {
            log.error("❌ [FCM] Status update error for topic {}: {}", topic, e.getMessage());
            return false;
        }
    }

    static String summarizeCleared(List<ClearedLine> clearedLines) {
        return clearedLines.stream()
                .map(c -> c.getLineName() + ": " + c.getCurrentStatus() + " (was " + c.getPreviousStatus() + ")")
                .collect(Collectors.joining(", "));
    }

    static String summarize(List<RouteDisruptionMatch> matches) {
        return matches.stream()
                .map(RouteDisruptionMatch::getDisruption)
                .map(d -> d.getLineName() + ": " + d.getStatusSeverityDescription())
                .distinct()
                .collect(Collectors.joining(", "));
    }

    private Map<String, Object> buildPayload(UserRoute route, RouteSchedule schedule,
            List<RouteDisruptionMatch> matches) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("routeId", route.getId());
        payload.put("routeName", route.getName());
        payload.put("scheduleId", schedule.getId());
        payload.put("disruptions", matches.stream().map(m -> {
            Disruption d = m.getDisruption();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("lineId", d.getLineId());
            item.put("lineName", d.getLineName());
            item.put("status", d.getStatusSeverityDescription());
            item.put("reason", d.getReason());
            item.put("affectedSegments", m.getAffectedSegments());
            item.put("affectedStations", m.getAffectedStations());
            return item;
        }).collect(Collectors.toList()));
        return payload;
    }
}
