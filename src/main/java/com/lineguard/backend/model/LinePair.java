package com.lineguard.backend.model;

import lombok.Value;

/**
 * A (line, station) fact: riding {@code lineId} through {@code stationId}.
 */
@Value
public class LinePair implements Comparable<LinePair> {
    String lineId;
    String stationId;

    @Override
    public int compareTo(LinePair other) {
        int byLine = lineId.compareTo(other.lineId);
        return byLine != 0 ? byLine : stationId.compareTo(other.stationId);
    }
}
