package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inverted index row: this route passes through {@code stationId} while riding
 * {@code lineId}. Superseded rows stay in the collection with
 * {@code active=false}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteStationIndexEntry {
    private String id;
    private String routeId;
    private String lineId;
    private String stationId;
    private String lineDataVersion;
    private boolean active;
    private String createdAt;
    private String supersededAt;

    public LinePair toPair() {
        return new LinePair(lineId, stationId);
    }
}
