package com.lineguard.backend.exception;

import lombok.Getter;

@Getter
public class SegmentExpansionException extends LineGuardException {

    private final String lineId;
    private final String fromStation;
    private final String toStation;

    public SegmentExpansionException(String lineId, String fromStation, String toStation, String message) {
        super(message);
        this.lineId = lineId;
        this.fromStation = fromStation;
        this.toStation = toStation;
    }

    public static SegmentExpansionException noConnectingVariant(String lineId, String from, String to) {
        return new SegmentExpansionException(lineId, from, to,
                String.format("No route variant on line %s contains both %s and %s", lineId, from, to));
    }

    public static SegmentExpansionException noVariants(String lineId, String from, String to) {
        return new SegmentExpansionException(lineId, from, to,
                String.format("Line %s has no route variant data", lineId));
    }
}
