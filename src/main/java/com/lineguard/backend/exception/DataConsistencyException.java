package com.lineguard.backend.exception;

import lombok.Getter;

import java.util.List;

/**
 * A station claims a hub, but no station in that hub serves the requested
 * line. Upstream reference data needs repair; retrying will not help.
 */
@Getter
public class DataConsistencyException extends LineGuardException {

    private final String hubCode;
    private final String lineId;
    private final List<String> availableStations;

    public DataConsistencyException(String hubCode, String lineId, List<String> availableStations) {
        super(String.format("Hub '%s' has no station serving line '%s'. Available stations: %s",
                hubCode, lineId, String.join(", ", availableStations)));
        this.hubCode = hubCode;
        this.lineId = lineId;
        this.availableStations = availableStations;
    }
}
