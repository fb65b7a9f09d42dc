package com.lineguard.backend.service;

import com.lineguard.backend.exception.SegmentExpansionException;
import com.lineguard.backend.model.Line;
import com.lineguard.backend.model.RouteVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a (from, to) pair on one line into every station passed in between.
 *
 * <p>Each route variant holding both stations contributes its stretch between
 * them, in whichever order they appear. When several branches connect the pair
 * all of their stations are kept, since the rider's branch is unknown.
 */
@Component
@Slf4j
public class RouteVariantExpander {

    /**
     * @return station ids, deduplicated in first-seen order, both ends included
     * @throws SegmentExpansionException if no variant of the line contains both stations
     */
    public List<String> expand(String fromStation, String toStation, Line line) {
        List<RouteVariant> variants = line.getRouteVariants();
        if (variants == null || variants.isEmpty()) {
            throw SegmentExpansionException.noVariants(line.getId(), fromStation, toStation);
        }

        Set<String> stations = new LinkedHashSet<>();
        int matched = 0;
        for (RouteVariant variant : variants) {
            List<String> between = findStationsBetween(variant.getStations(), fromStation, toStation);
            if (between.isEmpty()) {
                continue;
            }
            matched++;
            stations.addAll(between);
            log.debug("Variant '{}' of {} connects {} and {} via {} stations",
                    variant.getName(), line.getId(), fromStation, toStation, between.size());
        }

        if (matched == 0) {
            throw SegmentExpansionException.noConnectingVariant(line.getId(), fromStation, toStation);
        }

        log.debug("Expanded {} -> {} on {}: {} variants, {} unique stations",
                fromStation, toStation, line.getId(), matched, stations.size());
        return new ArrayList<>(stations);
    }

    /**
     * Inclusive stretch of {@code stations} between the two ids, independent of
     * their order. Empty when either id is absent.
     */
    public static List<String> findStationsBetween(List<String> stations, String from, String to) {
        if (stations == null) {
            return Collections.emptyList();
        }
        int fromIdx = stations.indexOf(from);
        int toIdx = stations.indexOf(to);
        if (fromIdx < 0 || toIdx < 0) {
            return Collections.emptyList();
        }
        return new ArrayList<>(stations.subList(Math.min(fromIdx, toIdx), Math.max(fromIdx, toIdx) + 1));
    }

    /**
     * True if at least one variant of the line holds both stations.
     */
    public boolean connects(String fromStation, String toStation, Line line) {
        if (line.getRouteVariants() == null) {
            return false;
        }
        return line.getRouteVariants().stream()
                .anyMatch(v -> !findStationsBetween(v.getStations(), fromStation, toStation).isEmpty());
    }
}
