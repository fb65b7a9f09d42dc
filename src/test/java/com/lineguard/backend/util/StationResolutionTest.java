package com.lineguard.backend.util;

import com.lineguard.backend.model.Station;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StationResolutionTest {

    private static Station station(String id, String hub, String... lines) {
        return Station.builder()
                .naptanId(id)
                .commonName(id + " Station")
                .hubNaptanCode(hub)
                .lines(List.of(lines))
                .build();
    }

    @Test
    void testCanonicalId_HubMember_ReturnsHubCode() {
        assertEquals("HUBSVS", StationResolution.canonicalId(station("940GZZLUSVS", "HUBSVS", "victoria")));
        assertEquals("940GZZLUOXC", StationResolution.canonicalId(station("940GZZLUOXC", null, "victoria")));
    }

    @Test
    void testCanonicalId_SameForEveryHubMember() {
        Station tube = station("940GZZLUSVS", "HUBSVS", "victoria");
        Station rail = station("910GSEVNSIS", "HUBSVS", "weaver");

        assertEquals(StationResolution.canonicalId(tube), StationResolution.canonicalId(rail));
    }

    @Test
    void testSelectDeterministic_PicksSmallestId_RegardlessOfOrder() {
        Station b = station("B", "HUB", "x");
        Station a = station("A", "HUB", "x");

        assertEquals("A", StationResolution.selectDeterministic(List.of(b, a)).getNaptanId());
        assertEquals("A", StationResolution.selectDeterministic(List.of(a, b)).getNaptanId());
    }

    @Test
    void testSelectDeterministic_Empty_Throws() {
        assertThrows(IllegalArgumentException.class, () -> StationResolution.selectDeterministic(List.of()));
    }

    @Test
    void testAggregateHubRepresentative_UnionsLinesAndTakesLatestUpdate() {
        // Given
        Station tube = station("940GZZLUSVS", "HUBSVS", "victoria");
        tube.setHubCommonName("Seven Sisters");
        tube.setLat(51.58);
        tube.setLastUpdatedTime("2024-01-01T10:00:00Z");
        Station rail = station("910GSEVNSIS", "HUBSVS", "weaver", "victoria");
        rail.setLastUpdatedTime("2024-03-01T10:00:00Z");

        // When
        Station hub = StationResolution.aggregateHubRepresentative(List.of(tube, rail));

        // Then
        assertEquals("HUBSVS", hub.getNaptanId());
        assertEquals("Seven Sisters", hub.getCommonName());
        assertEquals(List.of("victoria", "weaver"), hub.getLines());
        assertEquals(51.58, hub.getLat());
        assertEquals("2024-03-01T10:00:00Z", hub.getLastUpdatedTime());
    }

    @Test
    void testAggregateHubRepresentative_PreferredChildNotMember_Throws() {
        Station tube = station("940GZZLUSVS", "HUBSVS", "victoria");
        Station outsider = station("940GZZLUOXC", null, "central");

        assertThrows(IllegalArgumentException.class,
                () -> StationResolution.aggregateHubRepresentative(List.of(tube), outsider));
    }

    @Test
    void testAggregateHubRepresentative_PreferredChildGivesIdentity() {
        Station tube = station("940GZZLUSVS", "HUBSVS", "victoria");
        tube.setLon(-0.07);
        Station rail = station("910GSEVNSIS", "HUBSVS", "weaver");
        rail.setLon(-0.08);

        Station hub = StationResolution.aggregateHubRepresentative(List.of(tube, rail), rail);

        assertEquals(-0.08, hub.getLon());
        assertEquals("910GSEVNSIS Station", hub.getCommonName());
    }

    @Test
    void testCompareTimestamps_FallsBackToStringOrder() {
        assertTrue(StationResolution.compareTimestamps("2024-01-02T00:00:00Z", "2024-01-01T00:00:00Z") > 0);
        assertTrue(StationResolution.compareTimestamps("b", "a") > 0);
    }
}
