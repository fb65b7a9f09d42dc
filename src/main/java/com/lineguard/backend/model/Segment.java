package com.lineguard.backend.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One stop of a user route: either ridden away from on a line ({@link Transit})
 * or the end of the journey ({@link Destination}).
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class Segment {

    private final int sequence;
    private final String stationId;

    private Segment(int sequence, String stationId) {
        this.sequence = sequence;
        this.stationId = stationId;
    }

    public abstract boolean isTransit();

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Transit extends Segment {
        private final String lineId;

        public Transit(int sequence, String stationId, String lineId) {
            super(sequence, stationId);
            this.lineId = lineId;
        }

        @Override
        public boolean isTransit() {
            return true;
        }

        public LinePair toPair() {
            return new LinePair(lineId, getStationId());
        }
    }

    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Destination extends Segment {

        public Destination(int sequence, String stationId) {
            super(sequence, stationId);
        }

        @Override
        public boolean isTransit() {
            return false;
        }
    }
}
