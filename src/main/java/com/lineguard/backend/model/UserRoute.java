package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRoute {
    private String id;
    private String userId;
    private String name;
    private boolean active;

    // IANA zone id, e.g. Europe/London
    @Builder.Default
    private String timezone = "Europe/London";

    @Builder.Default
    private List<RouteSegment> segments = new ArrayList<>();

    @Builder.Default
    private List<RouteSchedule> schedules = new ArrayList<>();

    public List<Segment> orderedSegments() {
        if (segments == null) {
            return new ArrayList<>();
        }
        return segments.stream()
                .sorted(Comparator.comparingInt(RouteSegment::getSequence))
                .map(RouteSegment::toSegment)
                .collect(Collectors.toList());
    }
}
