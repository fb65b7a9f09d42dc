package com.lineguard.backend.service;

import com.lineguard.backend.exception.ReferenceDataException;
import com.lineguard.backend.exception.RouteValidationException;
import com.lineguard.backend.exception.SegmentExpansionException;
import com.lineguard.backend.model.IndexBuildResult;
import com.lineguard.backend.model.Line;
import com.lineguard.backend.model.LinePair;
import com.lineguard.backend.model.RebuildSummary;
import com.lineguard.backend.model.RouteStationIndexEntry;
import com.lineguard.backend.model.Segment;
import com.lineguard.backend.model.UserRoute;
import com.lineguard.backend.repository.DataRepository;
import com.lineguard.backend.repository.RouteStationIndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Maintains the inverted (line, station) index of every user route.
 *
 * <p>Each consecutive segment pair is expanded to all stations ridden between
 * the two stops, so a disruption at an intermediate station still reaches the
 * route. The whole active set of a route is swapped in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouteIndexService {

    private final DataRepository<UserRoute, String> userRouteRepository;
    private final DataRepository<Line, String> lineRepository;
    private final RouteStationIndexRepository indexRepository;
    private final StationResolverService stationResolver;
    private final RouteVariantExpander variantExpander;
    private final Clock clock;

    /**
     * @throws ReferenceDataException   if the route, a line or a station is unknown
     * @throws RouteValidationException if the route has fewer than two segments
     */
    public IndexBuildResult buildRouteStationIndex(String routeId) {
        UserRoute route = userRouteRepository.findById(routeId)
                .orElseThrow(() -> ReferenceDataException.routeNotFound(routeId));
        return buildRouteStationIndex(route);
    }

    /**
     * Rebuilds the index of an already loaded route.
     *
     * <p>A segment pair no route variant connects is logged and skipped; the
     * rest of the route is still indexed and the result reports it as degraded.
     * Hub data inconsistencies and missing reference data are not skipped.
     */
    public IndexBuildResult buildRouteStationIndex(UserRoute route) {
        List<Segment> segments = route.orderedSegments();
        if (segments.size() < 2) {
            throw new RouteValidationException(
                    "Route " + route.getId() + " needs at least 2 segments, found " + segments.size());
        }

        Map<LinePair, String> versions = new LinkedHashMap<>();
        Map<String, Line> lines = new HashMap<>();
        int processed = 0;
        int skipped = 0;

        for (int i = 0; i < segments.size() - 1; i++) {
            Segment current = segments.get(i);
            Segment next = segments.get(i + 1);
            if (!(current instanceof Segment.Transit)) {
                log.warn("⚠️ Route {} segment {} has no line; skipping pair", route.getId(), current.getSequence());
                skipped++;
                continue;
            }
            String lineId = ((Segment.Transit) current).getLineId();
            Line line = lines.computeIfAbsent(lineId, id -> lineRepository.findById(id)
                    .orElseThrow(() -> ReferenceDataException.lineNotFound(id)));

            String from = stationResolver.resolveStationForLine(current.getStationId(), lineId);
            String to = stationResolver.resolveStationForLine(next.getStationId(), lineId);

            try {
                for (String stationId : variantExpander.expand(from, to, line)) {
                    versions.putIfAbsent(new LinePair(lineId, stationId), line.getLastUpdatedTime());
                }
                processed++;
            } catch (SegmentExpansionException e) {
                log.warn("⚠️ Route {} pair {} -> {} on {} not indexed: {}",
                        route.getId(), from, to, lineId, e.getMessage());
                skipped++;
            }
        }

        String createdAt = Instant.now(clock).toString();
        List<RouteStationIndexEntry> entries = versions.entrySet().stream()
                .map(e -> RouteStationIndexEntry.builder()
                        .routeId(route.getId())
                        .lineId(e.getKey().getLineId())
                        .stationId(e.getKey().getStationId())
                        .lineDataVersion(e.getValue())
                        .active(true)
                        .createdAt(createdAt)
                        .build())
                .collect(Collectors.toList());

        int superseded = indexRepository.replaceActiveEntries(route.getId(), entries);

        IndexBuildResult result = IndexBuildResult.builder()
                .routeId(route.getId())
                .entriesCreated(entries.size())
                .pairsProcessed(processed)
                .pairsSkipped(skipped)
                .entriesSuperseded(superseded)
                .build();

        if (result.isDegraded()) {
            log.warn("⚠️ Route {} indexed with {} of {} pairs skipped ({} entries)",
                    route.getId(), skipped, processed + skipped, entries.size());
        } else {
            log.info("✅ Route {} indexed: {} entries from {} pairs ({} superseded)",
                    route.getId(), entries.size(), processed, superseded);
        }
        return result;
    }

    /**
     * Rebuilds one route, or every active route when {@code routeId} is null.
     * A failing route is counted and the batch carries on.
     */
    public RebuildSummary rebuildRoutes(String routeId) {
        if (routeId != null) {
            return rebuildAll(List.of(routeId), "ROUTE " + routeId);
        }
        List<String> ids = userRouteRepository.findByField("active", true).stream()
                .map(UserRoute::getId)
                .collect(Collectors.toList());
        return rebuildAll(ids, "ALL ACTIVE ROUTES");
    }

    /**
     * Routes whose active index entries were built from line data that has
     * since changed, or whose line no longer exists. Active routes with no
     * active entries are included, so a route left unindexed by an earlier
     * failure is retried once reference data is repaired.
     */
    public Set<String> findStaleRoutes() {
        Map<String, Optional<Line>> lines = new HashMap<>();
        Set<String> indexed = new HashSet<>();
        Set<String> stale = new TreeSet<>();
        for (RouteStationIndexEntry entry : indexRepository.findAllActive()) {
            indexed.add(entry.getRouteId());
            if (stale.contains(entry.getRouteId())) {
                continue;
            }
            Optional<Line> line = lines.computeIfAbsent(entry.getLineId(), lineRepository::findById);
            if (line.isEmpty() || !Objects.equals(line.get().getLastUpdatedTime(), entry.getLineDataVersion())) {
                stale.add(entry.getRouteId());
            }
        }
        for (UserRoute route : userRouteRepository.findByField("active", true)) {
            if (!indexed.contains(route.getId())) {
                stale.add(route.getId());
            }
        }
        return stale;
    }

    public RebuildSummary rebuildStaleRoutes() {
        Set<String> stale = findStaleRoutes();
        if (stale.isEmpty()) {
            log.info("✅ No stale route indexes");
            return RebuildSummary.builder().build();
        }
        return rebuildAll(stale, "STALE ROUTES");
    }

    public Set<LinePair> getRouteIndexPairs(String routeId) {
        return indexRepository.findActiveByRouteId(routeId).stream()
                .map(RouteStationIndexEntry::toPair)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private RebuildSummary rebuildAll(Collection<String> routeIds, String scope) {
        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ 🔄 ROUTE INDEX REBUILD STARTED | Scope: {} | Routes: {}", scope, routeIds.size());
        log.info("╚═══════════════════════════════════════════════════════════════════");

        int rebuilt = 0;
        int degraded = 0;
        List<String> errors = new ArrayList<>();

        for (String id : routeIds) {
            try {
                IndexBuildResult result = buildRouteStationIndex(id);
                rebuilt++;
                if (result.isDegraded()) {
                    degraded++;
                }
            } catch (RuntimeException e) {
                log.error("   ❌ Route {} rebuild failed: {}", id, e.getMessage());
                errors.add(id + ": " + e.getMessage());
            }
        }

        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ ✅ ROUTE INDEX REBUILD COMPLETED | Rebuilt: {} | Degraded: {} | Failed: {}",
                rebuilt, degraded, errors.size());
        log.info("╚═══════════════════════════════════════════════════════════════════");

        return RebuildSummary.builder()
                .rebuiltCount(rebuilt)
                .degradedCount(degraded)
                .failedCount(errors.size())
                .errors(errors)
                .build();
    }
}
