package com.lineguard.backend.util;

import com.lineguard.backend.model.Station;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Pure station/hub helpers. No lookups happen here; callers pass in the
 * stations they already loaded.
 */
public final class StationResolution {

    private StationResolution() {
    }

    /**
     * Identifier preferred in responses: the hub code when the station belongs
     * to a hub, otherwise the station's own id.
     */
    public static String canonicalId(Station station) {
        return station.hasHub() ? station.getHubNaptanCode() : station.getNaptanId();
    }

    public static List<Station> filterByLine(List<Station> stations, String lineId) {
        return stations.stream()
                .filter(s -> s.servesLine(lineId))
                .collect(Collectors.toList());
    }

    /**
     * Picks the station with the lexicographically smallest id so repeated
     * resolution of an ambiguous hub always lands on the same member.
     */
    public static Station selectDeterministic(List<Station> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot select from empty station list");
        }
        return candidates.stream()
                .min(Comparator.comparing(Station::getNaptanId))
                .orElseThrow();
    }

    public static Station aggregateHubRepresentative(List<Station> children) {
        return aggregateHubRepresentative(children, null);
    }

    /**
     * Builds a synthetic station standing for a whole hub.
     *
     * @param children       every member station of the hub, non-empty
     * @param preferredChild member used for name and coordinates, or null for
     *                       the first child
     */
    public static Station aggregateHubRepresentative(List<Station> children, Station preferredChild) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty hub");
        }
        if (preferredChild != null && children.stream()
                .noneMatch(c -> Objects.equals(c.getNaptanId(), preferredChild.getNaptanId()))) {
            throw new IllegalArgumentException(
                    "Preferred station " + preferredChild.getNaptanId() + " is not a member of the hub");
        }
        Station identity = preferredChild != null ? preferredChild : children.get(0);

        TreeSet<String> lines = new TreeSet<>();
        for (Station child : children) {
            if (child.getLines() != null) {
                lines.addAll(child.getLines());
            }
        }

        String hubCode = identity.hasHub() ? identity.getHubNaptanCode() : identity.getNaptanId();
        String name = identity.getHubCommonName() != null ? identity.getHubCommonName() : identity.getCommonName();

        return Station.builder()
                .naptanId(hubCode)
                .commonName(name)
                .lat(identity.getLat())
                .lon(identity.getLon())
                .lines(new ArrayList<>(lines))
                .hubNaptanCode(identity.getHubNaptanCode())
                .hubCommonName(identity.getHubCommonName())
                .lastUpdatedTime(latestTimestamp(children))
                .build();
    }

    private static String latestTimestamp(List<Station> stations) {
        return stations.stream()
                .map(Station::getLastUpdatedTime)
                .filter(Objects::nonNull)
                .max(StationResolution::compareTimestamps)
                .orElse(null);
    }

    static int compareTimestamps(String a, String b) {
        Instant first = parseInstant(a);
        Instant second = parseInstant(b);
        if (first != null && second != null) {
            return first.compareTo(second);
        }
        return a.compareTo(b);
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
