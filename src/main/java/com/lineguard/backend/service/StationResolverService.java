package com.lineguard.backend.service;

import com.lineguard.backend.exception.DataConsistencyException;
import com.lineguard.backend.exception.ReferenceDataException;
import com.lineguard.backend.model.Station;
import com.lineguard.backend.repository.DataRepository;
import com.lineguard.backend.util.StationResolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves interchange hubs to the concrete member station serving a line.
 * Hub membership is looked up on demand rather than kept in a precomputed map.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StationResolverService {

    private final DataRepository<Station, String> stationRepository;

    /**
     * Returns the id of the station to look up in {@code lineId}'s route
     * variants. A station outside any hub is returned as is; a hub member is
     * swapped for the hub sibling that serves the line.
     *
     * @throws DataConsistencyException if no station in the hub serves the line
     */
    public String resolveStationForLine(Station station, String lineId) {
        if (!station.hasHub()) {
            return station.getNaptanId();
        }

        List<Station> members = hubMembers(station.getHubNaptanCode());
        if (members.stream().noneMatch(m -> m.getNaptanId().equals(station.getNaptanId()))) {
            members.add(station);
        }

        Station resolved = pickServingStation(station.getHubNaptanCode(), members, lineId);
        if (!resolved.getNaptanId().equals(station.getNaptanId())) {
            log.debug("Hub {} resolved {} -> {} for line {}",
                    station.getHubNaptanCode(), station.getNaptanId(), resolved.getNaptanId(), lineId);
        }
        return resolved.getNaptanId();
    }

    /**
     * Same as {@link #resolveStationForLine(Station, String)} but accepts either
     * a station id or a hub code.
     */
    public String resolveStationForLine(String stationOrHubId, String lineId) {
        return resolveStationOrHub(stationOrHubId, lineId).getNaptanId();
    }

    /**
     * Looks up a station id or hub code.
     * <ul>
     * <li>station id, no line: the station itself</li>
     * <li>station id with line: the station, or its hub sibling serving the line</li>
     * <li>hub code with line: the hub member serving the line</li>
     * <li>hub code, no line: a synthetic station standing for the whole hub</li>
     * </ul>
     *
     * @throws ReferenceDataException   if the id is neither a station nor a hub
     * @throws DataConsistencyException if a hub has no member serving the line
     */
    public Station resolveStationOrHub(String stationOrHubId, String lineId) {
        Optional<Station> direct = stationRepository.findById(stationOrHubId);
        if (direct.isPresent()) {
            Station station = direct.get();
            if (lineId == null || !station.hasHub()) {
                return station;
            }
            String resolvedId = resolveStationForLine(station, lineId);
            if (resolvedId.equals(station.getNaptanId())) {
                return station;
            }
            return stationRepository.findById(resolvedId)
                    .orElseThrow(() -> ReferenceDataException.stationNotFound(resolvedId));
        }

        List<Station> members = hubMembers(stationOrHubId);
        if (members.isEmpty()) {
            throw ReferenceDataException.stationNotFound(stationOrHubId);
        }
        if (lineId == null) {
            return StationResolution.aggregateHubRepresentative(members);
        }
        return pickServingStation(stationOrHubId, members, lineId);
    }

    /**
     * True when the station, or any member of its hub, serves the line.
     */
    public boolean servesLine(Station station, String lineId) {
        if (station.servesLine(lineId)) {
            return true;
        }
        return station.hasHub() && hubMembers(station.getHubNaptanCode()).stream()
                .anyMatch(m -> m.servesLine(lineId));
    }

    public List<Station> hubMembers(String hubCode) {
        return new ArrayList<>(stationRepository.findByField("hubNaptanCode", hubCode));
    }

    private Station pickServingStation(String hubCode, List<Station> members, String lineId) {
        List<Station> candidates = StationResolution.filterByLine(members, lineId);
        if (candidates.isEmpty()) {
            List<String> available = members.stream()
                    .map(Station::getNaptanId)
                    .sorted()
                    .collect(Collectors.toList());
            log.error("❌ Hub {} has no station on line {} (members: {})", hubCode, lineId, available);
            throw new DataConsistencyException(hubCode, lineId, available);
        }
        return StationResolution.selectDeterministic(candidates);
    }
}
