package com.lineguard.backend.service;

import com.lineguard.backend.client.TflApi;
import com.lineguard.backend.model.AffectedSection;
import com.lineguard.backend.model.Disruption;
import com.lineguard.backend.util.TflUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads current line statuses from TfL as {@link Disruption}s. Good Service
 * statuses are only kept for cleared-line detection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisruptionService {

    private final TflApi tflApi;

    @Value("${tfl.transport.modes:tube}")
    private String tflTransportModes;

    /**
     * Fetches all configured modes in one request. Feed failures propagate so
     * the caller can skip the whole cycle.
     */
    public List<Disruption> fetchDisruptions() {
        return withoutGoodService(fetchLineStatuses());
    }

    /**
     * Every current line status, Good Service included, so callers can see
     * which lines are back to normal.
     */
    public List<Disruption> fetchLineStatuses() {
        String modes = String.join(",", TflUtils.parseModes(tflTransportModes));
        log.info("📡 Fetching line statuses for modes: {}", modes);

        List<Map<String, Object>> lines = tflApi.getLineStatuses(modes);
        if (lines == null || lines.isEmpty()) {
            log.warn("⚠️ No line statuses received for modes: {}", modes);
            return Collections.emptyList();
        }

        List<Disruption> statuses = new ArrayList<>();
        for (Map<String, Object> line : lines) {
            statuses.addAll(mapLineStatuses(line));
        }
        log.info("✅ {} statuses across {} lines", statuses.size(), lines.size());
        return statuses;
    }

    public static List<Disruption> withoutGoodService(List<Disruption> statuses) {
        return statuses.stream()
                .filter(d -> d.getStatusSeverity() != TflUtils.GOOD_SERVICE_SEVERITY)
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    List<Disruption> mapLineStatuses(Map<String, Object> line) {
        List<Map<String, Object>> statuses = (List<Map<String, Object>>) line.get("lineStatuses");
        if (statuses == null) {
            return Collections.emptyList();
        }

        List<Disruption> disruptions = new ArrayList<>();
        for (Map<String, Object> status : statuses) {
            int severity = status.get("statusSeverity") instanceof Number
                    ? ((Number) status.get("statusSeverity")).intValue()
                    : TflUtils.GOOD_SERVICE_SEVERITY;
            disruptions.add(Disruption.builder()
                    .lineId((String) line.get("id"))
                    .lineName((String) line.get("name"))
                    .mode((String) line.get("modeName"))
                    .statusSeverity(severity)
                    .statusSeverityDescription((String) status.get("statusSeverityDescription"))
                    .reason((String) status.get("reason"))
                    .affectedSections(mapSections((Map<String, Object>) status.get("disruption")))
                    .build());
        }
        return disruptions;
    }

    @SuppressWarnings("unchecked")
    private List<AffectedSection> mapSections(Map<String, Object> disruption) {
        List<AffectedSection> sections = new ArrayList<>();
        if (disruption == null) {
            return sections;
        }

        List<Map<String, Object>> routes = (List<Map<String, Object>>) disruption.get("affectedRoutes");
        if (routes != null) {
            for (Map<String, Object> route : routes) {
                Set<String> stations = new LinkedHashSet<>();
                List<Map<String, Object>> sequence =
                        (List<Map<String, Object>>) route.get("routeSectionNaptanEntrySequence");
                if (sequence != null) {
                    for (Map<String, Object> entry : sequence) {
                        Map<String, Object> stopPoint = (Map<String, Object>) entry.get("stopPoint");
                        if (stopPoint != null && stopPoint.get("naptanId") != null) {
                            stations.add((String) stopPoint.get("naptanId"));
                        }
                    }
                }
                if (!stations.isEmpty()) {
                    sections.add(AffectedSection.builder()
                            .name((String) route.get("name"))
                            .direction((String) route.get("direction"))
                            .affectedStations(new ArrayList<>(stations))
                            .build());
                }
            }
        }

        List<Map<String, Object>> stops = (List<Map<String, Object>>) disruption.get("affectedStops");
        if (stops != null) {
            Set<String> stations = new LinkedHashSet<>();
            for (Map<String, Object> stop : stops) {
                if (stop.get("naptanId") != null) {
                    stations.add((String) stop.get("naptanId"));
                }
            }
            if (!stations.isEmpty()) {
                sections.add(AffectedSection.builder()
                        .name("Affected stops")
                        .affectedStations(new ArrayList<>(stations))
                        .build());
            }
        }
        return sections;
    }
}
