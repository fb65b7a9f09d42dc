package com.lineguard.backend.service;

import com.lineguard.backend.model.AlertCycleSummary;
import com.lineguard.backend.model.AlertDecision;
import com.lineguard.backend.model.AlertedStatus;
import com.lineguard.backend.model.ClearedLine;
import com.lineguard.backend.model.Disruption;
import com.lineguard.backend.model.LinePair;
import com.lineguard.backend.model.RouteDisruptionMatch;
import com.lineguard.backend.model.RouteSchedule;
import com.lineguard.backend.model.UserRoute;
import com.lineguard.backend.repository.DataRepository;
import com.lineguard.backend.util.ScheduleWindows;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One alert cycle: fetch line statuses once, then for every active route
 * inside a monitoring window match, deduplicate and dispatch. Lines alerted
 * earlier in the window that are back to normal get a status update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    enum RouteOutcome {
        OUTSIDE_WINDOW,
        NO_MATCH,
        SENT,
        SUPPRESSED,
        DISPATCH_FAILED
    }

    enum StatusUpdate {
        NONE,
        SENT,
        FAILED
    }

    @Value
    static class RouteResult {
        RouteOutcome outcome;
        StatusUpdate statusUpdate;
    }

    private final DataRepository<UserRoute, String> userRouteRepository;
    private final DisruptionService disruptionService;
    private final DisruptionMatchingService disruptionMatchingService;
    private final RouteIndexService routeIndexService;
    private final AlertDeduplicationService alertDeduplicationService;
    private final NotificationDispatcher notificationDispatcher;
    private final MonitoringService monitoringService;
    private final Clock clock;

    public AlertCycleSummary processAllRoutes() {
        long startTime = System.currentTimeMillis();
        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ 🔔 ALERT CYCLE STARTED");
        log.info("╚═══════════════════════════════════════════════════════════════════");

        log.info("📡 Step 1: Fetching line statuses...");
        List<Disruption> lineStatuses;
        List<Disruption> alertable;
        try {
            lineStatuses = disruptionService.fetchLineStatuses();
            alertable = disruptionMatchingService.filterAlertableDisruptions(
                    DisruptionService.withoutGoodService(lineStatuses));
        } catch (RuntimeException e) {
            log.error("❌ Step 1: Disruption feed unavailable, skipping cycle: {}", e.getMessage());
            return failedCycle(startTime);
        }
        Set<String> clearedStates = disruptionMatchingService.loadClearedStates();
        log.info("✅ Step 1: {} alertable disruptions, {} cleared states", alertable.size(), clearedStates.size());

        log.info("📥 Step 2: Loading active routes...");
        List<UserRoute> routes;
        try {
            routes = userRouteRepository.findByField("active", true);
        } catch (RuntimeException e) {
            log.error("❌ Step 2: Could not load active routes, skipping cycle: {}", e.getMessage());
            return failedCycle(startTime);
        }
        log.info("✅ Step 2: Loaded {} active routes", routes.size());

        log.info("🔄 Step 3: Processing routes...");
        int checked = 0;
        int inWindow = 0;
        int sent = 0;
        int suppressed = 0;
        int statusUpdates = 0;
        int errors = 0;

        for (UserRoute route : routes) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("⚠️ Alert cycle interrupted after {} of {} routes", checked, routes.size());
                break;
            }
            checked++;
            try {
                RouteResult result = processRoute(route, alertable, lineStatuses, clearedStates);
                if (result.getOutcome() != RouteOutcome.OUTSIDE_WINDOW) {
                    inWindow++;
                }
                switch (result.getOutcome()) {
                    case SENT:
                        sent++;
                        break;
                    case SUPPRESSED:
                        suppressed++;
                        break;
                    case DISPATCH_FAILED:
                        errors++;
                        break;
                    default:
                        break;
                }
                if (result.getStatusUpdate() == StatusUpdate.SENT) {
                    statusUpdates++;
                } else if (result.getStatusUpdate() == StatusUpdate.FAILED) {
                    errors++;
                }
            } catch (RuntimeException e) {
                log.error("   ❌ Route {} failed: {}", route.getId(), e.getMessage());
                errors++;
            }
        }

        long processingTime = System.currentTimeMillis() - startTime;
        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ ✅ ALERT CYCLE COMPLETED | Routes: {} | In window: {} | Sent: {} | Suppressed: {} | Status updates: {} | Errors: {} | Time: {}ms",
                checked, inWindow, sent, suppressed, statusUpdates, errors, processingTime);
        log.info("╚═══════════════════════════════════════════════════════════════════");

        monitoringService.recordJobDuration("alerts", processingTime, errors == 0 ? "SUCCESS" : "PARTIAL");
        monitoringService.recordAlertCounts(sent, suppressed, errors);

        return AlertCycleSummary.builder()
                .routesChecked(checked)
                .routesInWindow(inWindow)
                .alertsSent(sent)
                .alertsSuppressed(suppressed)
                .statusUpdatesSent(statusUpdates)
                .errors(errors)
                .processingTimeMs(processingTime)
                .build();
    }

    RouteResult processRoute(UserRoute route, List<Disruption> alertable, List<Disruption> lineStatuses,
            Set<String> clearedStates) {
        ZonedDateTime nowLocal = ZonedDateTime.now(clock).withZoneSameInstant(ZoneId.of(route.getTimezone()));
        Optional<RouteSchedule> active = ScheduleWindows.findActiveSchedule(route.getSchedules(), nowLocal);
        if (active.isEmpty()) {
            return new RouteResult(RouteOutcome.OUTSIDE_WINDOW, StatusUpdate.NONE);
        }
        RouteSchedule schedule = active.get();

        Set<LinePair> routePairs = routeIndexService.getRouteIndexPairs(route.getId());
        if (routePairs.isEmpty()) {
            log.warn("   ⚠️ Route {} has no index entries", route.getId());
            return new RouteResult(RouteOutcome.NO_MATCH, StatusUpdate.NONE);
        }

        List<RouteDisruptionMatch> matches =
                disruptionMatchingService.buildRouteMatches(route, routePairs, alertable);
        List<Disruption> matched = matches.stream()
                .map(RouteDisruptionMatch::getDisruption)
                .collect(Collectors.toList());

        StatusUpdate statusUpdate = sendStatusUpdate(route, schedule, matched, lineStatuses, clearedStates);
        if (matches.isEmpty()) {
            return new RouteResult(RouteOutcome.NO_MATCH, statusUpdate);
        }

        AlertDecision decision = alertDeduplicationService.shouldSendAlert(
                route.getId(), route.getUserId(), schedule.getId(), matched);
        if (!decision.isSend()) {
            log.info("   🔕 Route {}: alert unchanged, suppressed", route.getId());
            return new RouteResult(RouteOutcome.SUPPRESSED, statusUpdate);
        }

        if (!notificationDispatcher.dispatch(route, schedule, matches)) {
            log.error("   ❌ Route {}: alert dispatch failed", route.getId());
            return new RouteResult(RouteOutcome.DISPATCH_FAILED, statusUpdate);
        }

        alertDeduplicationService.recordAlertSent(route.getId(), route.getUserId(), schedule.getId(),
                decision.getContentHash(), matched, route.getTimezone(), LocalTime.parse(schedule.getEndTime()));
        log.info("   🔔 Route {}: alert sent ({}, {} disruptions)", route.getId(), decision.getReason(), matched.size());
        return new RouteResult(RouteOutcome.SENT, statusUpdate);
    }

    /**
     * Tells the user when lines from their last alert in this window are back
     * to normal. Runs before the alert check so the stored alert no longer
     * holds the cleared lines.
     */
    private StatusUpdate sendStatusUpdate(UserRoute route, RouteSchedule schedule, List<Disruption> matched,
            List<Disruption> lineStatuses, Set<String> clearedStates) {
        if (clearedStates.isEmpty()) {
            return StatusUpdate.NONE;
        }
        List<AlertedStatus> alerted = alertDeduplicationService.readAlertedStatuses(
                route.getId(), route.getUserId(), schedule.getId());
        if (alerted.isEmpty()) {
            return StatusUpdate.NONE;
        }

        Set<String> stillDisrupted = matched.stream()
                .map(Disruption::getLineId)
                .collect(Collectors.toSet());
        List<ClearedLine> cleared = disruptionMatchingService.detectClearedLines(
                alerted, stillDisrupted, lineStatuses, clearedStates);
        if (cleared.isEmpty()) {
            return StatusUpdate.NONE;
        }

        if (!notificationDispatcher.dispatchStatusUpdate(route, schedule, cleared)) {
            log.error("   ❌ Route {}: status update dispatch failed", route.getId());
            return StatusUpdate.FAILED;
        }
        alertDeduplicationService.removeClearedLines(route.getId(), route.getUserId(), schedule.getId(),
                cleared.stream().map(ClearedLine::getLineId).collect(Collectors.toList()),
                route.getTimezone(), LocalTime.parse(schedule.getEndTime()));
        log.info("   ✅ Route {}: status update sent ({} lines cleared)", route.getId(), cleared.size());
        return StatusUpdate.SENT;
    }

    private AlertCycleSummary failedCycle(long startTime) {
        long elapsed = System.currentTimeMillis() - startTime;
        monitoringService.recordJobDuration("alerts", elapsed, "FAILED");
        return AlertCycleSummary.builder()
                .errors(1)
                .processingTimeMs(elapsed)
                .build();
    }
}
