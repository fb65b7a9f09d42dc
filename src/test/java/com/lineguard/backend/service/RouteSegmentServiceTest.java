package com.lineguard.backend.service;

import com.lineguard.backend.exception.ReferenceDataException;
import com.lineguard.backend.exception.RouteValidationException;
import com.lineguard.backend.model.IndexBuildResult;
import com.lineguard.backend.model.Line;
import com.lineguard.backend.model.RouteSegment;
import com.lineguard.backend.model.RouteVariant;
import com.lineguard.backend.model.Station;
import com.lineguard.backend.model.UserRoute;
import com.lineguard.backend.repository.DataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RouteSegmentServiceTest {

    @Mock
    private DataRepository<UserRoute, String> userRouteRepository;
    @Mock
    private DataRepository<Line, String> lineRepository;
    @Mock
    private StationResolverService stationResolver;
    @Mock
    private RouteIndexService routeIndexService;

    private RouteSegmentService routeSegmentService;
    private UserRoute route;

    private final Line victoria = Line.builder()
            .id("victoria")
            .routeVariants(List.of(RouteVariant.builder()
                    .name("Brixton - Walthamstow")
                    .stations(List.of("BRX", "VIC", "OXC", "KGX"))
                    .build()))
            .build();

    @BeforeEach
    void setUp() {
        routeSegmentService = new RouteSegmentService(userRouteRepository, lineRepository, stationResolver,
                new RouteVariantExpander(), routeIndexService);
        route = UserRoute.builder()
                .id("r1")
                .userId("u1")
                .segments(new ArrayList<>(List.of(seg(0, "BRX", "victoria"), seg(1, "VIC", null))))
                .build();
    }

    private static RouteSegment seg(int sequence, String station, String line) {
        return RouteSegment.builder().sequence(sequence).stationId(station).lineId(line).build();
    }

    private void referenceDataIsValid() {
        lenient().when(lineRepository.findById("victoria")).thenReturn(Optional.of(victoria));
        lenient().when(stationResolver.resolveStationOrHub(anyString(), isNull()))
                .thenAnswer(inv -> Station.builder().naptanId(inv.getArgument(0)).build());
        lenient().when(stationResolver.servesLine(any(Station.class), eq("victoria"))).thenReturn(true);
        lenient().when(stationResolver.resolveStationForLine(anyString(), eq("victoria")))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void testReplaceSegments_Valid_SavesAndRebuilds() {
        // Given
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        referenceDataIsValid();
        IndexBuildResult built = IndexBuildResult.builder().routeId("r1").entriesCreated(3).build();
        when(routeIndexService.buildRouteStationIndex(route)).thenReturn(built);

        // When
        IndexBuildResult result = routeSegmentService.replaceSegments("r1",
                List.of(seg(1, "OXC", null), seg(0, "BRX", "victoria")));

        // Then
        assertSame(built, result);
        assertEquals("BRX", route.getSegments().get(0).getStationId());
        assertEquals("OXC", route.getSegments().get(1).getStationId());
        verify(userRouteRepository, times(1)).save(route);
    }

    @Test
    void testReplaceSegments_TooFewSegments_RejectedBeforeWrite() {
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));

        assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1", List.of(seg(0, "BRX", null))));
        verify(userRouteRepository, never()).save(any());
        verifyNoInteractions(routeIndexService);
    }

    @Test
    void testReplaceSegments_GapInSequence_ReportsPosition() {
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));

        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", "victoria"), seg(2, "VIC", null))));
        assertEquals(1, e.getInvalidSegmentIndex());
    }

    @Test
    void testReplaceSegments_FinalSegmentWithLine_Rejected() {
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));

        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", "victoria"), seg(1, "VIC", "victoria"))));
        assertEquals(1, e.getInvalidSegmentIndex());
    }

    @Test
    void testReplaceSegments_IntermediateSegmentWithoutLine_Rejected() {
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));

        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", null), seg(1, "VIC", null))));
        assertEquals(0, e.getInvalidSegmentIndex());
    }

    @Test
    void testReplaceSegments_UnknownStation_Rejected() {
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        when(lineRepository.findById("victoria")).thenReturn(Optional.of(victoria));
        when(stationResolver.resolveStationOrHub("NOPE", null)).thenThrow(ReferenceDataException.stationNotFound("NOPE"));

        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "NOPE", "victoria"), seg(1, "VIC", null))));
        assertEquals(0, e.getInvalidSegmentIndex());
        verify(userRouteRepository, never()).save(any());
    }

    @Test
    void testReplaceSegments_StationNotOnLine_Rejected() {
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        referenceDataIsValid();
        Station paddington = Station.builder().naptanId("PAD").lines(List.of("bakerloo")).build();
        when(stationResolver.resolveStationOrHub("PAD", null)).thenReturn(paddington);
        when(stationResolver.servesLine(paddington, "victoria")).thenReturn(false);

        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", "victoria"), seg(1, "PAD", null))));
        assertEquals(1, e.getInvalidSegmentIndex());
    }

    @Test
    void testReplaceSegments_NoVariantConnectsStations_Rejected() {
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        referenceDataIsValid();

        assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", "victoria"), seg(1, "WAL", null))));
        verify(userRouteRepository, never()).save(any());
    }

    @Test
    void testReplaceSegments_RebuildFails_RestoresPreviousSegments() {
        // Given
        List<RouteSegment> previous = route.getSegments();
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        referenceDataIsValid();
        when(routeIndexService.buildRouteStationIndex(route))
                .thenThrow(new IllegalStateException("transaction aborted"));

        // When
        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", "victoria"), seg(1, "KGX", null))));

        // Then
        assertTrue(e.getMessage().contains("transaction aborted"));
        assertSame(previous, route.getSegments());
        verify(userRouteRepository, times(2)).save(route);
    }

    @Test
    void testReplaceSegments_SaveFails_NothingIndexed() {
        // Given
        List<RouteSegment> previous = route.getSegments();
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        referenceDataIsValid();
        doThrow(new IllegalStateException("Failed to save r1 to userRoutes"))
                .when(userRouteRepository).save(route);

        // When
        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", "victoria"), seg(1, "KGX", null))));

        // Then
        assertTrue(e.getMessage().contains("could not be saved"));
        assertSame(previous, route.getSegments());
        verifyNoInteractions(routeIndexService);
    }

    @Test
    void testReplaceSegments_RestoreFails_ReportedAsSuppressed() {
        // Given
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        referenceDataIsValid();
        when(routeIndexService.buildRouteStationIndex(route))
                .thenThrow(new IllegalStateException("transaction aborted"));
        IllegalStateException restoreFailure = new IllegalStateException("Failed to save r1 to userRoutes");
        doNothing().doThrow(restoreFailure).when(userRouteRepository).save(route);

        // When
        RouteValidationException e = assertThrows(RouteValidationException.class,
                () -> routeSegmentService.replaceSegments("r1",
                        List.of(seg(0, "BRX", "victoria"), seg(1, "KGX", null))));

        // Then
        assertTrue(e.getMessage().contains("could not be indexed"));
        assertEquals(1, e.getSuppressed().length);
        assertSame(restoreFailure, e.getSuppressed()[0]);
    }

    @Test
    void testUpsertSegment_ReplacesBySequence() {
        // Given
        when(userRouteRepository.findById("r1")).thenReturn(Optional.of(route));
        referenceDataIsValid();
        when(routeIndexService.buildRouteStationIndex(route)).thenReturn(IndexBuildResult.builder().build());

        // When
        routeSegmentService.upsertSegment("r1", seg(1, "KGX", null));

        // Then
        ArgumentCaptor<UserRoute> saved = ArgumentCaptor.forClass(UserRoute.class);
        verify(userRouteRepository).save(saved.capture());
        assertEquals(2, saved.getValue().getSegments().size());
        assertEquals("KGX", saved.getValue().getSegments().get(1).getStationId());
    }
}
