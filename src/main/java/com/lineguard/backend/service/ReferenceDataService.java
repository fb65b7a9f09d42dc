package com.lineguard.backend.service;

import com.lineguard.backend.client.TflApi;
import com.lineguard.backend.model.Line;
import com.lineguard.backend.model.RebuildSummary;
import com.lineguard.backend.model.ReferenceSyncSummary;
import com.lineguard.backend.model.RouteVariant;
import com.lineguard.backend.model.Station;
import com.lineguard.backend.repository.DataRepository;
import com.lineguard.backend.util.TflUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps lines, their route variants and their stations in step with TfL, then
 * rebuilds any route index built from outdated line data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataService {

    private final TflApi tflApi;
    private final DataRepository<Line, String> lineRepository;
    private final DataRepository<Station, String> stationRepository;
    private final RouteIndexService routeIndexService;
    private final Clock clock;

    @Value("${tfl.transport.modes:tube}")
    private String tflTransportModes;

    public ReferenceSyncSummary syncLines() {
        long startTime = System.currentTimeMillis();
        List<String> modes = TflUtils.parseModes(tflTransportModes);

        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ 🚇 REFERENCE DATA SYNC STARTED | Modes: {}", modes);
        log.info("╚═══════════════════════════════════════════════════════════════════");

        log.info("📥 Step 1: Loading existing lines and stations from Firestore...");
        Map<String, Line> existingLines = lineRepository.findAll().stream()
                .collect(Collectors.toMap(Line::getId, Function.identity(), (a, b) -> a));
        Map<String, Station> existingStations = stationRepository.findAll().stream()
                .collect(Collectors.toMap(Station::getNaptanId, Function.identity(), (a, b) -> a));
        log.info("✅ Step 1: Loaded {} lines and {} stations", existingLines.size(), existingStations.size());

        log.info("📋 Step 2: Fetching lines for {} modes...", modes.size());
        String now = Instant.now(clock).toString();
        List<Line> changedLines = new ArrayList<>();
        Map<String, Station> freshStations = new HashMap<>();
        Map<String, Set<String>> servedThisRun = new HashMap<>();
        Set<String> syncedLines = new HashSet<>();
        int processed = 0;
        int failed = 0;

        for (String mode : modes) {
            List<Map<String, Object>> rawLines;
            try {
                rawLines = tflApi.getLinesByMode(mode);
            } catch (RuntimeException e) {
                log.error("   ❌ [{}] Failed to fetch lines: {}", mode, e.getMessage());
                failed++;
                continue;
            }
            if (rawLines == null || rawLines.isEmpty()) {
                log.warn("   ⚠️ [{}] No lines received", mode);
                continue;
            }

            for (Map<String, Object> raw : rawLines) {
                String lineId = (String) raw.get("id");
                try {
                    List<RouteVariant> variants = fetchRouteVariants(lineId);
                    Line existing = existingLines.get(lineId);
                    Line fresh = Line.builder()
                            .id(lineId)
                            .name((String) raw.get("name"))
                            .modeName((String) raw.get("modeName"))
                            .routeVariants(variants)
                            .lastUpdatedTime(existing != null && Objects.equals(existing.getRouteVariants(), variants)
                                    ? existing.getLastUpdatedTime()
                                    : now)
                            .build();
                    if (!fresh.equals(existing)) {
                        changedLines.add(fresh);
                    }
                    if (mergeStations(fresh, existingStations, freshStations, servedThisRun, now)) {
                        syncedLines.add(lineId);
                    }
                    processed++;
                } catch (RuntimeException e) {
                    log.error("   ❌ [{}] Failed to sync line {}: {}", mode, lineId, e.getMessage());
                    failed++;
                }
            }
            log.info("   ✅ [{}] Processed {} lines", mode, rawLines.size());
        }

        pruneDepartedLines(syncedLines, servedThisRun, existingStations, freshStations, now);
        List<Station> changedStations = freshStations.values().stream()
                .filter(fresh -> !fresh.equals(existingStations.get(fresh.getNaptanId())))
                .collect(Collectors.toList());

        log.info("💾 Step 3: Saving {} changed lines and {} changed stations...",
                changedLines.size(), changedStations.size());
        lineRepository.saveAll(changedLines);
        stationRepository.saveAll(changedStations);

        log.info("🔄 Step 4: Rebuilding stale route indexes...");
        RebuildSummary rebuild = routeIndexService.rebuildStaleRoutes();

        long processingTime = System.currentTimeMillis() - startTime;
        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ ✅ REFERENCE DATA SYNC COMPLETED | Lines: {} | Changed: {} | Failed: {} | Stations changed: {} | Routes rebuilt: {} | Time: {}ms",
                processed, changedLines.size(), failed, changedStations.size(), rebuild.getRebuiltCount(),
                processingTime);
        log.info("╚═══════════════════════════════════════════════════════════════════");

        return ReferenceSyncSummary.builder()
                .linesProcessed(processed)
                .linesChanged(changedLines.size())
                .linesFailed(failed)
                .stationsChanged(changedStations.size())
                .indexRebuild(rebuild)
                .processingTimeMs(processingTime)
                .build();
    }

    @SuppressWarnings("unchecked")
    List<RouteVariant> fetchRouteVariants(String lineId) {
        List<RouteVariant> variants = new ArrayList<>();
        for (String direction : TflUtils.ROUTE_DIRECTIONS) {
            Map<String, Object> sequence = tflApi.getRouteSequence(lineId, direction);
            if (sequence == null) {
                continue;
            }
            List<Map<String, Object>> ordered = (List<Map<String, Object>>) sequence.get("orderedLineRoutes");
            if (ordered == null) {
                continue;
            }
            for (Map<String, Object> route : ordered) {
                List<String> ids = (List<String>) route.get("naptanIds");
                if (ids == null || ids.isEmpty()) {
                    continue;
                }
                variants.add(RouteVariant.builder()
                        .name((String) route.get("name"))
                        .serviceType((String) route.get("serviceType"))
                        .direction(direction)
                        .stations(new ArrayList<>(ids))
                        .build());
            }
        }
        return variants;
    }

    /**
     * Adds the line to every stop on its route variants, keeping lines other
     * syncs have already recorded on the stop.
     *
     * @return false if TfL returned no stop points, so the line's stations
     *         were left untouched
     */
    private boolean mergeStations(Line line, Map<String, Station> existingStations,
            Map<String, Station> freshStations, Map<String, Set<String>> servedThisRun, String now) {
        List<Map<String, Object>> stopPoints = tflApi.getStopPointsByLine(line.getId());
        if (stopPoints == null) {
            return false;
        }

        Set<String> onVariants = new HashSet<>();
        line.getRouteVariants().forEach(v -> onVariants.addAll(v.getStations()));

        for (Map<String, Object> sp : stopPoints) {
            String naptanId = (String) sp.get("naptanId");
            if (naptanId == null || !onVariants.contains(naptanId)) {
                continue;
            }
            servedThisRun.computeIfAbsent(naptanId, k -> new HashSet<>()).add(line.getId());

            Station existing = existingStations.get(naptanId);
            Station current = freshStations.get(naptanId);
            Set<String> lines = new TreeSet<>();
            if (current != null) {
                lines.addAll(current.getLines());
            } else if (existing != null && existing.getLines() != null) {
                lines.addAll(existing.getLines());
            }
            lines.add(line.getId());

            Station fresh = Station.builder()
                    .naptanId(naptanId)
                    .commonName((String) sp.get("commonName"))
                    .lat(sp.get("lat") instanceof Number ? ((Number) sp.get("lat")).doubleValue() : 0)
                    .lon(sp.get("lon") instanceof Number ? ((Number) sp.get("lon")).doubleValue() : 0)
                    .lines(new ArrayList<>(lines))
                    .hubNaptanCode((String) sp.get("hubNaptanCode"))
                    .hubCommonName(existing != null ? existing.getHubCommonName() : null)
                    .lastUpdatedTime(existing != null ? existing.getLastUpdatedTime() : now)
                    .build();

            if (existing != null && !sameContent(existing, fresh)) {
                fresh.setLastUpdatedTime(now);
            }
            freshStations.put(naptanId, fresh);
        }
        return true;
    }

    /**
     * Removes a synced line from every station it no longer serves, including
     * stations no line touched this run. Lines that failed to sync are left
     * as recorded.
     */
    private void pruneDepartedLines(Set<String> syncedLines, Map<String, Set<String>> servedThisRun,
            Map<String, Station> existingStations, Map<String, Station> freshStations, String now) {
        for (Station existing : existingStations.values()) {
            if (freshStations.containsKey(existing.getNaptanId()) || existing.getLines() == null
                    || existing.getLines().stream().noneMatch(syncedLines::contains)) {
                continue;
            }
            freshStations.put(existing.getNaptanId(), Station.builder()
                    .naptanId(existing.getNaptanId())
                    .commonName(existing.getCommonName())
                    .lat(existing.getLat())
                    .lon(existing.getLon())
                    .lines(new ArrayList<>(existing.getLines()))
                    .hubNaptanCode(existing.getHubNaptanCode())
                    .hubCommonName(existing.getHubCommonName())
                    .lastUpdatedTime(existing.getLastUpdatedTime())
                    .build());
        }

        for (Station station : freshStations.values()) {
            Set<String> served = servedThisRun.getOrDefault(station.getNaptanId(), Set.of());
            List<String> kept = station.getLines().stream()
                    .filter(lineId -> !syncedLines.contains(lineId) || served.contains(lineId))
                    .collect(Collectors.toList());
            if (kept.size() < station.getLines().size()) {
                log.info("   🧹 Station {} no longer served by {}", station.getNaptanId(),
                        station.getLines().stream().filter(l -> !kept.contains(l)).collect(Collectors.toList()));
                station.setLines(kept);
                station.setLastUpdatedTime(now);
            }
        }
    }

    private boolean sameContent(Station existing, Station fresh) {
        return Objects.equals(existing.getCommonName(), fresh.getCommonName())
                && existing.getLat() == fresh.getLat()
                && existing.getLon() == fresh.getLon()
                && Objects.equals(existing.getHubNaptanCode(), fresh.getHubNaptanCode())
                && Objects.equals(existing.getLines(), fresh.getLines());
    }
}
