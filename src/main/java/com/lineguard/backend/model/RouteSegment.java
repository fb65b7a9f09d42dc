package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored shape of one segment of a user route. The final segment of a route
 * carries no line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteSegment {
    private int sequence;
    private String stationId;
    private String lineId;

    public Segment toSegment() {
        if (lineId == null || lineId.isEmpty()) {
            return new Segment.Destination(sequence, stationId);
        }
        return new Segment.Transit(sequence, stationId, lineId);
    }
}
