package com.lineguard.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lineguard.backend.model.AlertDecision;
import com.lineguard.backend.model.AlertDedupState;
import com.lineguard.backend.model.AlertedStatus;
import com.lineguard.backend.model.Disruption;
import com.lineguard.backend.util.ScheduleWindows;
import com.lineguard.backend.util.TflUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides whether an alert for a route and schedule window repeats the last
 * one sent. State lives in Redis and expires when the window closes.
 *
 * <p>Every failure resolves toward sending: a duplicate alert is acceptable,
 * a missed one is not.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertDeduplicationService {

    private static final Comparator<List<String>> TRIPLE_ORDER = Comparator
            .<List<String>, String>comparing(t -> t.get(0))
            .thenComparing(t -> t.get(1))
            .thenComparing(t -> t.get(2));

    private final AlertStateCache alertStateCache;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * SHA-256 over the (line, status, reason) triples of the disruptions,
     * sorted, so the hash is independent of feed order and ignores fields
     * that do not change what the user is told.
     */
    public String computeContentHash(List<Disruption> disruptions) {
        List<List<String>> triples = disruptions.stream()
                .map(d -> List.of(
                        nullToEmpty(d.getLineId()),
                        nullToEmpty(d.getStatusSeverityDescription()),
                        nullToEmpty(d.getReason())))
                .sorted(TRIPLE_ORDER)
                .collect(Collectors.toList());
        try {
            byte[] json = objectMapper.writeValueAsBytes(triples);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to hash disruption content", e);
        }
    }

    public AlertDecision shouldSendAlert(String routeId, String userId, String scheduleId,
            List<Disruption> disruptions) {
        String hash = computeContentHash(disruptions);
        String key = TflUtils.alertStateKey(routeId, userId, scheduleId);

        if (!alertStateCache.isEnabled()) {
            return decision(true, hash, AlertDecision.Reason.CACHE_UNAVAILABLE);
        }

        Optional<String> stored;
        try {
            stored = alertStateCache.read(key);
        } catch (RuntimeException e) {
            log.warn("⚠️ Alert state read failed for {}, sending: {}", key, e.getMessage());
            return decision(true, hash, AlertDecision.Reason.CACHE_UNAVAILABLE);
        }

        if (stored.isEmpty()) {
            return decision(true, hash, AlertDecision.Reason.NO_PREVIOUS_STATE);
        }

        AlertDedupState state;
        try {
            state = objectMapper.readValue(stored.get(), AlertDedupState.class);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable alert state for {}, sending: {}", key, e.getOriginalMessage());
            return decision(true, hash, AlertDecision.Reason.UNREADABLE_STATE);
        }
        // A stored JSON null reads back as a null state
        if (state == null) {
            log.warn("⚠️ Empty alert state for {}, sending", key);
            return decision(true, hash, AlertDecision.Reason.UNREADABLE_STATE);
        }

        if (hash.equals(state.getContentHash())) {
            log.debug("Alert for {} unchanged since {}", key, state.getTimestamp());
            return decision(false, hash, AlertDecision.Reason.UNCHANGED);
        }
        return decision(true, hash, AlertDecision.Reason.CONTENT_CHANGED);
    }

    /**
     * Stores the hash of an alert just sent, expiring at the end of today's
     * window in the route's timezone. Nothing is stored once the window has
     * closed. Cache failures are logged and never thrown.
     */
    public void recordAlertSent(String routeId, String userId, String scheduleId, String contentHash,
            String timezone, LocalTime endTime) {
        recordAlertSent(routeId, userId, scheduleId, contentHash, List.of(), timezone, endTime);
    }

    /**
     * As above, also keeping the statuses sent so a later cycle can detect
     * lines that have cleared.
     */
    public void recordAlertSent(String routeId, String userId, String scheduleId, String contentHash,
            List<Disruption> sent, String timezone, LocalTime endTime) {
        AlertDedupState state = AlertDedupState.builder()
                .contentHash(contentHash)
                .timestamp(Instant.now(clock).toString())
                .statuses(sent.stream().map(AlertedStatus::from).collect(Collectors.toList()))
                .build();
        store(TflUtils.alertStateKey(routeId, userId, scheduleId), state, timezone, endTime);
    }

    /**
     * Statuses from the last alert sent in this window. Empty when there is no
     * readable state.
     */
    public List<AlertedStatus> readAlertedStatuses(String routeId, String userId, String scheduleId) {
        return readState(TflUtils.alertStateKey(routeId, userId, scheduleId))
                .map(AlertDedupState::getStatuses)
                .filter(Objects::nonNull)
                .orElse(List.of());
    }

    /**
     * Drops cleared lines from the stored alert and rehashes what is left, so
     * the remaining lines keep their dedup and a cleared line that breaks
     * again is alerted afresh.
     */
    public void removeClearedLines(String routeId, String userId, String scheduleId, Collection<String> lineIds,
            String timezone, LocalTime endTime) {
        String key = TflUtils.alertStateKey(routeId, userId, scheduleId);
        Optional<AlertDedupState> current = readState(key);
        if (current.isEmpty() || current.get().getStatuses() == null) {
            return;
        }
        List<AlertedStatus> remaining = current.get().getStatuses().stream()
                .filter(status -> !lineIds.contains(status.getLineId()))
                .collect(Collectors.toList());
        AlertDedupState updated = AlertDedupState.builder()
                .contentHash(computeContentHash(remaining.stream()
                        .map(AlertedStatus::toDisruption)
                        .collect(Collectors.toList())))
                .timestamp(Instant.now(clock).toString())
                .statuses(remaining)
                .build();
        store(key, updated, timezone, endTime);
        log.debug("Removed cleared lines {} from {}", lineIds, key);
    }

    public long calculateTtlSeconds(String timezone, LocalTime endTime) {
        return ScheduleWindows.secondsUntilEnd(ZonedDateTime.now(clock), ZoneId.of(timezone), endTime);
    }

    private void store(String key, AlertDedupState state, String timezone, LocalTime endTime) {
        long ttl = calculateTtlSeconds(timezone, endTime);
        if (ttl <= 0) {
            log.debug("Window already closed for {}, alert state not stored", key);
            return;
        }
        try {
            alertStateCache.write(key, objectMapper.writeValueAsString(state), ttl);
            log.debug("Stored alert state for {} (ttl={}s)", key, ttl);
        } catch (JsonProcessingException e) {
            log.error("❌ Failed to serialize alert state for {}", key, e);
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to store alert state for {}: {}", key, e.getMessage());
        }
    }

    private Optional<AlertDedupState> readState(String key) {
        if (!alertStateCache.isEnabled()) {
            return Optional.empty();
        }
        try {
            Optional<String> stored = alertStateCache.read(key);
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(stored.get(), AlertDedupState.class));
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable alert state for {}: {}", key, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("⚠️ Alert state read failed for {}: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    private static AlertDecision decision(boolean send, String hash, AlertDecision.Reason reason) {
        return AlertDecision.builder()
                .send(send)
                .contentHash(hash)
                .reason(reason)
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
