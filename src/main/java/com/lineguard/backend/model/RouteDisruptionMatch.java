package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A disruption that touches a route, with the user's own stops it hits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteDisruptionMatch {
    private Disruption disruption;

    // Ascending segment sequence numbers
    @Builder.Default
    private List<Integer> affectedSegments = new ArrayList<>();

    // Sorted station ids
    @Builder.Default
    private List<String> affectedStations = new ArrayList<>();
}
