package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A physical stop. Stations that share a hub code form one interchange,
 * each member serving its own subset of lines.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Station {

    private String naptanId;
    private String commonName;
    private double lat;
    private double lon;
    private String lastUpdatedTime;

    // Line ids served by this physical stop
    @Builder.Default
    private List<String> lines = new ArrayList<>();

    // Interchange grouping, e.g. HUBSVS for Seven Sisters
    private String hubNaptanCode;
    private String hubCommonName;

    public boolean hasHub() {
        return hubNaptanCode != null && !hubNaptanCode.isEmpty();
    }

    public boolean servesLine(String lineId) {
        return lines != null && lines.contains(lineId);
    }
}
