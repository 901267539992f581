package com.slb.fleet_backend.modules.asyncreq.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.exception.ConflictException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.asyncreq.config.AsyncRequestProperties;
import com.slb.fleet_backend.modules.asyncreq.domain.ResultEnvelope;
import com.slb.fleet_backend.modules.asyncreq.entity.AsyncRequest;
import com.slb.fleet_backend.modules.asyncreq.enums.AsyncRequestStatus;
import com.slb.fleet_backend.modules.asyncreq.mapper.AsyncRequestMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AsyncRequestTrackerTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Shanghai");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 1, 8, 0);

    @Mock
    private AsyncRequestMapper requestMapper;

    private AsyncRequestTracker tracker;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        tracker = new AsyncRequestTracker(requestMapper, new JsonColumnService(new ObjectMapper()),
                new AsyncRequestProperties(), clock);
    }

    @Test
    void create_storesPendingWithStartDeadline() {
        String id = tracker.create(7L, "fleet-action", Map.of("k", "v"));

        ArgumentCaptor<AsyncRequest> captor = ArgumentCaptor.forClass(AsyncRequest.class);
        verify(requestMapper).insert(captor.capture());
        AsyncRequest stored = captor.getValue();
        assertThat(id).matches("[0-9a-f]{32}");
        assertEquals(AsyncRequestStatus.PENDING, stored.getStatus());
        assertEquals(NOW.plusMinutes(5), stored.getStartBy());
        assertEquals("{\"k\":\"v\"}", stored.getPayload());
    }

    @Test
    void claim_secondClaimLoses() {
        when(requestMapper.findById("r1")).thenReturn(Optional.of(request("r1", AsyncRequestStatus.PENDING)));
        when(requestMapper.claim(eq("r1"), any())).thenReturn(1, 0);

        assertTrue(tracker.claim("r1"));
        assertFalse(tracker.claim("r1"));
    }

    @Test
    void claim_afterDeadline_neverStartsSoNeverCompletes() {
        AsyncRequest request = request("r1", AsyncRequestStatus.PENDING);
        request.setStartBy(NOW.minusSeconds(1));
        when(requestMapper.findById("r1")).thenReturn(Optional.of(request));

        assertFalse(tracker.claim("r1"));

        verify(requestMapper, never()).claim(any(), any());
        assertEquals(AsyncRequestStatus.EXPIRED, tracker.getStatus("r1", 7L).getStatus());
    }

    @Test
    void claim_atExactDeadline_stillAllowedAndNotReportedExpired() {
        AsyncRequest request = request("r1", AsyncRequestStatus.PENDING);
        request.setStartBy(NOW);
        when(requestMapper.findById("r1")).thenReturn(Optional.of(request));
        when(requestMapper.claim("r1", NOW)).thenReturn(1);

        assertEquals(AsyncRequestStatus.PENDING, tracker.getStatus("r1", 7L).getStatus());
        assertTrue(tracker.claim("r1"));
    }

    @Test
    void claim_alreadyExpiredBySweep_rejected() {
        when(requestMapper.findById("r1")).thenReturn(Optional.of(request("r1", AsyncRequestStatus.EXPIRED)));

        assertFalse(tracker.claim("r1"));
        verify(requestMapper, never()).claim(any(), any());
    }

    @Test
    void staleProcessing_usesProcessingTimeoutCutoff() {
        when(requestMapper.findStaleProcessingIds(NOW.minusMinutes(30), 50)).thenReturn(List.of("r9"));
        when(requestMapper.failStale(eq("r9"), eq(NOW.minusMinutes(30)), eq(500), anyString(), eq("{}"), eq(NOW)))
                .thenReturn(1);

        assertEquals(List.of("r9"), tracker.findStaleProcessing(50));
        assertTrue(tracker.failStale("r9", new ResultEnvelope(500, Map.of(), "{}")));
    }

    @Test
    void staleProcessing_finishedMeanwhile_isLeftAlone() {
        when(requestMapper.failStale(any(), any(), anyInt(), any(), any(), any())).thenReturn(0);

        assertFalse(tracker.failStale("r9", new ResultEnvelope(500, Map.of(), "{}")));
    }

    @Test
    void complete_failureStatusMapsToError() {
        when(requestMapper.complete(eq("r1"), eq(AsyncRequestStatus.ERROR), eq(404), anyString(), eq("{}"), any()))
                .thenReturn(1);

        tracker.complete("r1", new ResultEnvelope(404, Map.of(), "{}"));

        verify(requestMapper).complete(eq("r1"), eq(AsyncRequestStatus.ERROR), eq(404), anyString(), eq("{}"), any());
    }

    @Test
    void complete_notProcessing_conflicts() {
        when(requestMapper.complete(any(), any(), anyInt(), any(), any(), any())).thenReturn(0);

        assertThrows(ConflictException.class, () -> tracker.complete("r1", new ResultEnvelope(200, Map.of(), "{}")));
    }

    @Test
    void getStatus_pendingPastDeadline_reportedExpired() {
        AsyncRequest request = request("r1", AsyncRequestStatus.PENDING);
        request.setStartBy(NOW.minusSeconds(1));
        when(requestMapper.findById("r1")).thenReturn(Optional.of(request));

        assertEquals(AsyncRequestStatus.EXPIRED, tracker.getStatus("r1", 7L).getStatus());
    }

    @Test
    void getStatus_otherOwner_isNotFound() {
        when(requestMapper.findById("r1")).thenReturn(Optional.of(request("r1", AsyncRequestStatus.DONE)));

        assertThrows(NotFoundException.class, () -> tracker.getStatus("r1", 8L));
    }

    @Test
    void envelopeOf_replaysStoredResponse() {
        AsyncRequest request = request("r1", AsyncRequestStatus.DONE);
        request.setResultStatus(200);
        request.setResultHeaders("{\"Content-Type\":\"application/json\",\"X-Trace-Id\":\"r1\"}");
        request.setResultBody("{\"code\":0}");

        ResultEnvelope envelope = tracker.envelopeOf(request);

        assertEquals(200, envelope.status());
        assertEquals("r1", envelope.headers().get("X-Trace-Id"));
        assertEquals("{\"code\":0}", envelope.body());
        assertNull(tracker.envelopeOf(request("r2", AsyncRequestStatus.PROCESSING)));
    }

    @Test
    void purge_usesRetentionCutoff() {
        tracker.purge();

        verify(requestMapper).purgeFinishedBefore(NOW.minusHours(24));
    }

    private static AsyncRequest request(String id, AsyncRequestStatus status) {
        AsyncRequest request = new AsyncRequest();
        request.setId(id);
        request.setOwnerId(7L);
        request.setOperation("fleet-action");
        request.setStatus(status);
        request.setCreatedAt(NOW.minusMinutes(1));
        request.setStartBy(NOW.plusMinutes(4));
        return request;
    }
}
