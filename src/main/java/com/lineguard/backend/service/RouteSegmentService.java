package com.lineguard.backend.service;

import com.lineguard.backend.exception.LineGuardException;
import com.lineguard.backend.exception.ReferenceDataException;
import com.lineguard.backend.exception.RouteValidationException;
import com.lineguard.backend.model.IndexBuildResult;
import com.lineguard.backend.model.Line;
import com.lineguard.backend.model.RouteSegment;
import com.lineguard.backend.model.Station;
import com.lineguard.backend.model.UserRoute;
import com.lineguard.backend.repository.DataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Route segment mutations. A mutation is only kept if the route's index can be
 * rebuilt from it; otherwise the previous segments are restored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouteSegmentService {

    private final DataRepository<UserRoute, String> userRouteRepository;
    private final DataRepository<Line, String> lineRepository;
    private final StationResolverService stationResolver;
    private final RouteVariantExpander variantExpander;
    private final RouteIndexService routeIndexService;

    /**
     * Replaces every segment of the route and rebuilds its index.
     *
     * @throws ReferenceDataException   if the route does not exist
     * @throws RouteValidationException if the segments are invalid or cannot be
     *                                  saved (nothing is indexed), or the index
     *                                  rebuild failed (the previous segments are
     *                                  restored; a failed restore is attached as
     *                                  suppressed)
     */
    public IndexBuildResult replaceSegments(String routeId, List<RouteSegment> segments) {
        UserRoute route = userRouteRepository.findById(routeId)
                .orElseThrow(() -> ReferenceDataException.routeNotFound(routeId));

        List<RouteSegment> ordered = validateSegments(segments);

        List<RouteSegment> previous = route.getSegments();
        route.setSegments(ordered);
        try {
            userRouteRepository.save(route);
        } catch (IllegalStateException e) {
            route.setSegments(previous);
            throw new RouteValidationException("Route " + routeId + " could not be saved: " + e.getMessage(), e);
        }

        try {
            return routeIndexService.buildRouteStationIndex(route);
        } catch (LineGuardException | IllegalStateException e) {
            log.error("❌ Index rebuild failed for route {}; restoring previous segments: {}",
                    routeId, e.getMessage());
            route.setSegments(previous);
            RouteValidationException failure = new RouteValidationException(
                    "Route " + routeId + " could not be indexed: " + e.getMessage(), e);
            try {
                userRouteRepository.save(route);
            } catch (IllegalStateException restoreFailure) {
                log.error("❌ Could not restore previous segments for route {}: {}",
                        routeId, restoreFailure.getMessage());
                failure.addSuppressed(restoreFailure);
            }
            throw failure;
        }
    }

    /**
     * Replaces the segment with the same sequence number, or appends it.
     */
    public IndexBuildResult upsertSegment(String routeId, RouteSegment segment) {
        UserRoute route = userRouteRepository.findById(routeId)
                .orElseThrow(() -> ReferenceDataException.routeNotFound(routeId));

        List<RouteSegment> updated = new ArrayList<>();
        boolean replaced = false;
        for (RouteSegment existing : route.getSegments()) {
            if (existing.getSequence() == segment.getSequence()) {
                updated.add(segment);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(segment);
        }
        return replaceSegments(routeId, updated);
    }

    /**
     * Structural and reference checks.
     *
     * @return the segments ordered by sequence
     */
    List<RouteSegment> validateSegments(List<RouteSegment> segments) {
        if (segments == null || segments.size() < 2) {
            throw new RouteValidationException("A route needs at least 2 segments");
        }

        List<RouteSegment> ordered = new ArrayList<>(segments);
        ordered.sort(Comparator.comparingInt(RouteSegment::getSequence));

        int last = ordered.size() - 1;
        for (int i = 0; i < ordered.size(); i++) {
            RouteSegment segment = ordered.get(i);
            if (segment.getSequence() != i) {
                throw new RouteValidationException(
                        "Segment sequences must be consecutive from 0; found " + segment.getSequence()
                                + " at position " + i, i);
            }
            boolean hasLine = segment.getLineId() != null && !segment.getLineId().isEmpty();
            if (i < last && !hasLine) {
                throw new RouteValidationException("Segment " + i + " must name the line ridden from it", i);
            }
            if (i == last && hasLine) {
                throw new RouteValidationException("The final segment is the destination and takes no line", i);
            }
        }

        for (int i = 0; i < last; i++) {
            validatePair(ordered.get(i), ordered.get(i + 1), i);
        }
        return ordered;
    }

    private void validatePair(RouteSegment current, RouteSegment next, int index) {
        String lineId = current.getLineId();
        Line line = lineRepository.findById(lineId)
                .orElseThrow(() -> new RouteValidationException("Line '" + lineId + "' not found", index));

        Station from = lookup(current.getStationId(), index);
        Station to = lookup(next.getStationId(), index + 1);

        if (!stationResolver.servesLine(from, lineId)) {
            throw new RouteValidationException(
                    "Station '" + current.getStationId() + "' is not served by line '" + lineId + "'", index);
        }
        if (!stationResolver.servesLine(to, lineId)) {
            throw new RouteValidationException(
                    "Station '" + next.getStationId() + "' is not served by line '" + lineId + "'", index + 1);
        }

        String fromId;
        String toId;
        try {
            fromId = stationResolver.resolveStationForLine(current.getStationId(), lineId);
            toId = stationResolver.resolveStationForLine(next.getStationId(), lineId);
        } catch (LineGuardException e) {
            throw new RouteValidationException(e.getMessage(), index);
        }
        if (!variantExpander.connects(fromId, toId, line)) {
            throw new RouteValidationException(
                    "No route on line '" + lineId + "' connects '" + current.getStationId()
                            + "' and '" + next.getStationId() + "'", index);
        }
    }

    private Station lookup(String stationOrHubId, int index) {
        try {
            return stationResolver.resolveStationOrHub(stationOrHubId, null);
        } catch (ReferenceDataException e) {
            throw new RouteValidationException(e.getMessage(), index);
        }
    }
}
