package com.lineguard.backend.service;

import com.lineguard.backend.client.TflApi;
import com.lineguard.backend.model.Disruption;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DisruptionServiceTest {

    @Mock
    private TflApi tflApiClient;

    private DisruptionService disruptionService;

    @BeforeEach
    void setUp() {
        disruptionService = new DisruptionService(tflApiClient);
        ReflectionTestUtils.setField(disruptionService, "tflTransportModes", "tube, dlr");
    }

    @SafeVarargs
    private static Map<String, Object> line(String id, Map<String, Object>... statuses) {
        Map<String, Object> line = new HashMap<>();
        line.put("id", id);
        line.put("name", id.substring(0, 1).toUpperCase() + id.substring(1));
        line.put("modeName", "tube");
        line.put("lineStatuses", List.of(statuses));
        return line;
    }

    private static Map<String, Object> status(int severity, String description, Map<String, Object> disruption) {
        Map<String, Object> status = new HashMap<>();
        status.put("statusSeverity", severity);
        status.put("statusSeverityDescription", description);
        status.put("reason", severity == 10 ? null : "Victoria Line: Severe delays due to a signal failure.");
        status.put("disruption", disruption);
        return status;
    }

    @Test
    void testFetchDisruptions_MapsAffectedRoutesAndStops() {
        // Given
        Map<String, Object> disruption = new HashMap<>();
        disruption.put("affectedRoutes", List.of(Map.of(
                "name", "Brixton - Walthamstow Central",
                "direction", "inbound",
                "routeSectionNaptanEntrySequence", List.of(
                        Map.of("stopPoint", Map.of("naptanId", "940GZZLUSVS")),
                        Map.of("stopPoint", Map.of("naptanId", "940GZZLUFPK"))))));
        disruption.put("affectedStops", List.of(Map.of("naptanId", "940GZZLUVIC")));
        when(tflApiClient.getLineStatuses("tube,dlr"))
                .thenReturn(List.of(line("victoria", status(6, "Severe Delays", disruption))));

        // When
        List<Disruption> result = disruptionService.fetchDisruptions();

        // Then
        assertEquals(1, result.size());
        Disruption d = result.get(0);
        assertEquals("victoria", d.getLineId());
        assertEquals("Victoria", d.getLineName());
        assertEquals("tube", d.getMode());
        assertEquals(6, d.getStatusSeverity());
        assertEquals("Severe Delays", d.getStatusSeverityDescription());
        assertEquals(2, d.getAffectedSections().size());
        assertEquals(List.of("940GZZLUSVS", "940GZZLUFPK"), d.getAffectedSections().get(0).getAffectedStations());
        assertEquals("inbound", d.getAffectedSections().get(0).getDirection());
        assertEquals(List.of("940GZZLUVIC"), d.getAffectedSections().get(1).getAffectedStations());
    }

    @Test
    void testFetchDisruptions_GoodService_Skipped() {
        when(tflApiClient.getLineStatuses("tube,dlr"))
                .thenReturn(List.of(line("central", status(10, "Good Service", null))));

        assertTrue(disruptionService.fetchDisruptions().isEmpty());
    }

    @Test
    void testFetchLineStatuses_GoodServiceKept() {
        when(tflApiClient.getLineStatuses("tube,dlr")).thenReturn(List.of(
                line("central", status(10, "Good Service", null)),
                line("district", status(9, "Minor Delays", null))));

        List<Disruption> statuses = disruptionService.fetchLineStatuses();

        assertEquals(2, statuses.size());
        assertEquals("central", statuses.get(0).getLineId());
        assertEquals(10, statuses.get(0).getStatusSeverity());
        assertEquals(List.of(statuses.get(1)), DisruptionService.withoutGoodService(statuses));
    }

    @Test
    void testFetchDisruptions_NoStationDetail_EmptySections() {
        when(tflApiClient.getLineStatuses("tube,dlr"))
                .thenReturn(List.of(line("district", status(9, "Minor Delays", null))));

        List<Disruption> result = disruptionService.fetchDisruptions();

        assertEquals(1, result.size());
        assertTrue(result.get(0).getAffectedSections().isEmpty());
    }

    @Test
    void testFetchDisruptions_FeedFailure_Propagates() {
        when(tflApiClient.getLineStatuses("tube,dlr")).thenThrow(new IllegalStateException("timeout"));

        assertThrows(IllegalStateException.class, () -> disruptionService.fetchDisruptions());
    }
}
