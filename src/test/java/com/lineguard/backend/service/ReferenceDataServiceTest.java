package com.lineguard.backend.service;

import com.lineguard.backend.client.TflApi;
import com.lineguard.backend.model.Line;
import com.lineguard.backend.model.RebuildSummary;
import com.lineguard.backend.model.ReferenceSyncSummary;
import com.lineguard.backend.model.RouteVariant;
import com.lineguard.backend.model.Station;
import com.lineguard.backend.repository.DataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferenceDataServiceTest {

    private static final String NOW = "2024-06-03T03:30:00Z";

    @Mock
    private TflApi tflApiClient;
    @Mock
    private DataRepository<Line, String> lineRepository;
    @Mock
    private DataRepository<Station, String> stationRepository;
    @Mock
    private RouteIndexService routeIndexService;

    @Captor
    private ArgumentCaptor<List<Line>> linesCaptor;
    @Captor
    private ArgumentCaptor<List<Station>> stationsCaptor;

    private ReferenceDataService referenceDataService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse(NOW), ZoneOffset.UTC);
        referenceDataService = new ReferenceDataService(tflApiClient, lineRepository, stationRepository,
                routeIndexService, clock);
        ReflectionTestUtils.setField(referenceDataService, "tflTransportModes", "tube");
    }

    private static Map<String, Object> sequence(List<String> naptanIds) {
        return Map.of("orderedLineRoutes", List.of(Map.of(
                "name", "Brixton - Walthamstow",
                "serviceType", "Regular",
                "naptanIds", naptanIds)));
    }

    private static Map<String, Object> stop(String naptanId, String hub) {
        Map<String, Object> sp = new HashMap<>();
        sp.put("naptanId", naptanId);
        sp.put("commonName", naptanId + " Underground Station");
        sp.put("lat", 51.5);
        sp.put("lon", -0.1);
        sp.put("hubNaptanCode", hub);
        return sp;
    }

    private void victoriaFeed() {
        when(tflApiClient.getLinesByMode("tube"))
                .thenReturn(List.of(Map.of("id", "victoria", "name", "Victoria", "modeName", "tube")));
        when(tflApiClient.getRouteSequence("victoria", "inbound")).thenReturn(sequence(List.of("A", "B", "C")));
        when(tflApiClient.getRouteSequence("victoria", "outbound")).thenReturn(sequence(List.of("C", "B", "A")));
        when(tflApiClient.getStopPointsByLine("victoria"))
                .thenReturn(List.of(stop("A", null), stop("B", "HUBB"), stop("C", null), stop("Z", null)));
    }

    @Test
    void testSyncLines_NewLine_SavesVariantsAndStationsThenRebuildsStale() {
        // Given
        victoriaFeed();
        when(lineRepository.findAll()).thenReturn(List.of());
        Station a = Station.builder().naptanId("A").commonName("A Underground Station")
                .lat(51.5).lon(-0.1).lines(List.of("central")).lastUpdatedTime("old").build();
        when(stationRepository.findAll()).thenReturn(List.of(a));
        when(routeIndexService.rebuildStaleRoutes()).thenReturn(RebuildSummary.builder().rebuiltCount(2).build());

        // When
        ReferenceSyncSummary summary = referenceDataService.syncLines();

        // Then
        verify(lineRepository).saveAll(linesCaptor.capture());
        Line saved = linesCaptor.getValue().get(0);
        assertEquals(2, saved.getRouteVariants().size());
        assertEquals("inbound", saved.getRouteVariants().get(0).getDirection());
        assertEquals(List.of("C", "B", "A"), saved.getRouteVariants().get(1).getStations());
        assertEquals(NOW, saved.getLastUpdatedTime());

        verify(stationRepository).saveAll(stationsCaptor.capture());
        Map<String, Station> stations = stationsCaptor.getValue().stream()
                .collect(Collectors.toMap(Station::getNaptanId, Function.identity()));
        assertEquals(3, stations.size());
        assertFalse(stations.containsKey("Z"));
        assertEquals(List.of("central", "victoria"), stations.get("A").getLines());
        assertEquals(NOW, stations.get("A").getLastUpdatedTime());
        assertEquals("HUBB", stations.get("B").getHubNaptanCode());

        assertEquals(1, summary.getLinesProcessed());
        assertEquals(1, summary.getLinesChanged());
        assertEquals(2, summary.getIndexRebuild().getRebuiltCount());
    }

    @Test
    void testSyncLines_VariantsUnchanged_KeepsDataVersion() {
        // Given
        victoriaFeed();
        Line existing = Line.builder()
                .id("victoria")
                .name("Victoria")
                .modeName("tube")
                .lastUpdatedTime("v-old")
                .routeVariants(List.of(
                        RouteVariant.builder().name("Brixton - Walthamstow").serviceType("Regular")
                                .direction("inbound").stations(List.of("A", "B", "C")).build(),
                        RouteVariant.builder().name("Brixton - Walthamstow").serviceType("Regular")
                                .direction("outbound").stations(List.of("C", "B", "A")).build()))
                .build();
        when(lineRepository.findAll()).thenReturn(List.of(existing));
        when(stationRepository.findAll()).thenReturn(List.of());
        when(routeIndexService.rebuildStaleRoutes()).thenReturn(RebuildSummary.builder().build());

        // When
        ReferenceSyncSummary summary = referenceDataService.syncLines();

        // Then
        verify(lineRepository).saveAll(linesCaptor.capture());
        assertTrue(linesCaptor.getValue().isEmpty());
        assertEquals(0, summary.getLinesChanged());
    }

    @Test
    void testSyncLines_LineFails_OthersStillSynced() {
        // Given
        when(tflApiClient.getLinesByMode("tube")).thenReturn(List.of(
                Map.of("id", "broken", "name", "Broken", "modeName", "tube"),
                Map.of("id", "victoria", "name", "Victoria", "modeName", "tube")));
        when(tflApiClient.getRouteSequence("broken", "inbound")).thenThrow(new IllegalStateException("500"));
        when(tflApiClient.getRouteSequence("victoria", "inbound")).thenReturn(sequence(List.of("A", "B")));
        when(tflApiClient.getRouteSequence("victoria", "outbound")).thenReturn(sequence(List.of("B", "A")));
        when(tflApiClient.getStopPointsByLine("victoria")).thenReturn(List.of(stop("A", null), stop("B", null)));
        when(lineRepository.findAll()).thenReturn(List.of());
        when(stationRepository.findAll()).thenReturn(List.of());
        when(routeIndexService.rebuildStaleRoutes()).thenReturn(RebuildSummary.builder().build());

        // When
        ReferenceSyncSummary summary = referenceDataService.syncLines();

        // Then
        assertEquals(1, summary.getLinesProcessed());
        assertEquals(1, summary.getLinesFailed());
        assertEquals(2, summary.getStationsChanged());
    }

    @Test
    void testSyncLines_LineLeavesStop_RemovedFromStation() {
        // Given D used to be on the Victoria line but is on none of its variants now
        victoriaFeed();
        when(lineRepository.findAll()).thenReturn(List.of());
        Station d = Station.builder().naptanId("D").commonName("D Underground Station")
                .lines(List.of("jubilee", "victoria")).lastUpdatedTime("old").build();
        Station a = Station.builder().naptanId("A").commonName("A Underground Station")
                .lat(51.5).lon(-0.1).lines(List.of("victoria")).lastUpdatedTime("old").build();
        when(stationRepository.findAll()).thenReturn(List.of(a, d));
        when(routeIndexService.rebuildStaleRoutes()).thenReturn(RebuildSummary.builder().build());

        // When
        referenceDataService.syncLines();

        // Then
        verify(stationRepository).saveAll(stationsCaptor.capture());
        Map<String, Station> stations = stationsCaptor.getValue().stream()
                .collect(Collectors.toMap(Station::getNaptanId, Function.identity()));
        assertEquals(List.of("jubilee"), stations.get("D").getLines());
        assertEquals(NOW, stations.get("D").getLastUpdatedTime());
        assertFalse(stations.containsKey("A"));
    }
}
