package com.lineguard.backend.service;

import com.lineguard.backend.exception.LineGuardException;
import com.lineguard.backend.model.AffectedSection;
import com.lineguard.backend.model.AlertDisabledSeverity;
import com.lineguard.backend.model.AlertedStatus;
import com.lineguard.backend.model.ClearedLine;
import com.lineguard.backend.model.Disruption;
import com.lineguard.backend.model.LinePair;
import com.lineguard.backend.model.RouteDisruptionMatch;
import com.lineguard.backend.model.Segment;
import com.lineguard.backend.model.UserRoute;
import com.lineguard.backend.repository.DataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches live disruptions against route indexes at (line, station)
 * granularity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisruptionMatchingService {

    private final DataRepository<AlertDisabledSeverity, String> alertDisabledSeverityRepository;
    private final StationResolverService stationResolver;

    /**
     * Drops disruptions whose (mode, severity) an administrator has switched
     * off. If the switched-off set cannot be read every disruption is kept.
     */
    public List<Disruption> filterAlertableDisruptions(List<Disruption> disruptions) {
        Set<String> disabled;
        try {
            disabled = alertDisabledSeverityRepository.findAll().stream()
                    .map(AlertDisabledSeverity::pairKey)
                    .collect(Collectors.toSet());
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not load disabled severities, treating all disruptions as alertable: {}",
                    e.getMessage());
            return new ArrayList<>(disruptions);
        }

        List<Disruption> alertable = disruptions.stream()
                .filter(d -> !disabled.contains(AlertDisabledSeverity.pairKey(d.getMode(), d.getStatusSeverity())))
                .collect(Collectors.toList());
        if (alertable.size() < disruptions.size()) {
            log.info("🔕 Filtered {} disruptions with disabled severities", disruptions.size() - alertable.size());
        }
        return alertable;
    }

    /**
     * (mode, severity) keys that mean a line is back to normal. If they cannot
     * be read, cleared-line detection is skipped for the cycle.
     */
    public Set<String> loadClearedStates() {
        try {
            return alertDisabledSeverityRepository.findAll().stream()
                    .filter(AlertDisabledSeverity::isClearedState)
                    .map(AlertDisabledSeverity::pairKey)
                    .collect(Collectors.toSet());
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not load cleared states, skipping status updates: {}", e.getMessage());
            return Collections.emptySet();
        }
    }

    /**
     * Lines the user was alerted about that now report only cleared statuses.
     * A line still disrupted on the route, or missing from the feed, is not
     * cleared.
     *
     * @param alerted           statuses from the last alert sent
     * @param disruptedLineIds  lines with a disruption currently matching the route
     * @param lineStatuses      every current line status, Good Service included
     * @param clearedStates     keys from {@link #loadClearedStates()}
     */
    public List<ClearedLine> detectClearedLines(List<AlertedStatus> alerted, Set<String> disruptedLineIds,
            List<Disruption> lineStatuses, Set<String> clearedStates) {
        Map<String, AlertedStatus> previousByLine = new LinkedHashMap<>();
        for (AlertedStatus status : alerted) {
            previousByLine.putIfAbsent(status.getLineId(), status);
        }

        List<ClearedLine> cleared = new ArrayList<>();
        for (AlertedStatus previous : previousByLine.values()) {
            if (disruptedLineIds.contains(previous.getLineId())) {
                continue;
            }
            List<Disruption> current = lineStatuses.stream()
                    .filter(d -> previous.getLineId().equals(d.getLineId()))
                    .collect(Collectors.toList());
            if (current.isEmpty()) {
                continue;
            }
            boolean allCleared = current.stream()
                    .allMatch(d -> clearedStates.contains(
                            AlertDisabledSeverity.pairKey(d.getMode(), d.getStatusSeverity())));
            if (!allCleared) {
                continue;
            }
            Disruption now = current.get(0);
            cleared.add(ClearedLine.builder()
                    .lineId(now.getLineId())
                    .lineName(now.getLineName())
                    .mode(now.getMode())
                    .previousSeverity(previous.getStatusSeverity())
                    .previousStatus(previous.getStatusSeverityDescription())
                    .currentSeverity(now.getStatusSeverity())
                    .currentStatus(now.getStatusSeverityDescription())
                    .build());
        }
        return cleared;
    }

    public Set<LinePair> extractLineStationPairs(Disruption disruption) {
        Set<LinePair> pairs = new LinkedHashSet<>();
        if (disruption.getAffectedSections() == null) {
            return pairs;
        }
        for (AffectedSection section : disruption.getAffectedSections()) {
            if (section.getAffectedStations() == null) {
                continue;
            }
            for (String stationId : section.getAffectedStations()) {
                pairs.add(new LinePair(disruption.getLineId(), stationId));
            }
        }
        return pairs;
    }

    public boolean disruptionAffectsRoute(Set<LinePair> disruptionPairs, Set<LinePair> routePairs) {
        return !Collections.disjoint(disruptionPairs, routePairs);
    }

    /**
     * Disruptions sharing at least one (line, station) pair with the route.
     * Disruptions reported without any station never match.
     */
    public List<Disruption> matchDisruptionsToRoute(Set<LinePair> routePairs, List<Disruption> disruptions) {
        List<Disruption> matched = new ArrayList<>();
        int withoutStations = 0;
        for (Disruption disruption : disruptions) {
            Set<LinePair> pairs = extractLineStationPairs(disruption);
            if (pairs.isEmpty()) {
                withoutStations++;
                continue;
            }
            if (disruptionAffectsRoute(pairs, routePairs)) {
                matched.add(disruption);
            }
        }
        if (withoutStations > 0) {
            log.debug("{} disruptions carried no station detail and were not matched", withoutStations);
        }
        return matched;
    }

    /**
     * The route's segments with each transit station swapped for the hub
     * member serving the segment's line, as disruptions name physical stops.
     * A station that cannot be resolved is kept as entered.
     */
    public List<Segment> resolveSegments(UserRoute route) {
        List<Segment> resolved = new ArrayList<>();
        for (Segment segment : route.orderedSegments()) {
            if (!(segment instanceof Segment.Transit)) {
                resolved.add(segment);
                continue;
            }
            Segment.Transit transit = (Segment.Transit) segment;
            String stationId = transit.getStationId();
            try {
                stationId = stationResolver.resolveStationForLine(stationId, transit.getLineId());
            } catch (LineGuardException e) {
                log.debug("Route {} segment {} kept unresolved: {}",
                        route.getId(), transit.getSequence(), e.getMessage());
            }
            resolved.add(new Segment.Transit(transit.getSequence(), stationId, transit.getLineId()));
        }
        return resolved;
    }

    /**
     * @return ascending sequence numbers of transit segments whose own
     *         (line, station) is disrupted
     */
    public List<Integer> calculateAffectedSegments(List<Segment> segments, Set<LinePair> disruptionPairs) {
        return segments.stream()
                .filter(s -> s instanceof Segment.Transit)
                .map(s -> (Segment.Transit) s)
                .filter(t -> disruptionPairs.contains(t.toPair()))
                .map(Segment::getSequence)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * @return sorted unique station ids the route names that are disrupted;
     *         stations merely passed through are not reported
     */
    public List<String> calculateAffectedStations(Collection<LinePair> segmentPairs, Set<LinePair> disruptionPairs) {
        Set<LinePair> common = new HashSet<>(segmentPairs);
        common.retainAll(disruptionPairs);
        return common.stream()
                .map(LinePair::getStationId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    public List<RouteDisruptionMatch> buildRouteMatches(UserRoute route, Set<LinePair> routePairs,
            List<Disruption> disruptions) {
        List<Disruption> matched = matchDisruptionsToRoute(routePairs, disruptions);
        if (matched.isEmpty()) {
            return List.of();
        }

        List<Segment> segments = resolveSegments(route);
        List<LinePair> segmentPairs = segments.stream()
                .filter(s -> s instanceof Segment.Transit)
                .map(s -> ((Segment.Transit) s).toPair())
                .collect(Collectors.toList());

        List<RouteDisruptionMatch> matches = new ArrayList<>();
        for (Disruption disruption : matched) {
            Set<LinePair> pairs = extractLineStationPairs(disruption);
            matches.add(RouteDisruptionMatch.builder()
                    .disruption(disruption)
                    .affectedSegments(calculateAffectedSegments(segments, pairs))
                    .affectedStations(calculateAffectedStations(segmentPairs, pairs))
                    .build());
        }
        log.debug("Route {} matched {} disruptions", route.getId(), matches.size());
        return matches;
    }
}
