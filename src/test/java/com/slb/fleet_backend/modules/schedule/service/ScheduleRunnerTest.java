package com.slb.fleet_backend.modules.schedule.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.common.service.RedisService;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncRequestTracker;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncRequestWorker;
import com.slb.fleet_backend.modules.command.service.FleetActionService;
import com.slb.fleet_backend.modules.schedule.config.ScheduleProperties;
import com.slb.fleet_backend.modules.schedule.entity.Schedule;
import com.slb.fleet_backend.modules.schedule.mapper.ScheduleMapper;
import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import com.slb.fleet_backend.modules.selection.service.SelectionResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScheduleRunnerTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Shanghai");
    private static final LocalDateTime LAUNCH = LocalDateTime.of(2026, 10, 1, 8, 0);

    @Mock
    private ScheduleMapper scheduleMapper;
    @Mock
    private SelectionResolver selectionResolver;
    @Mock
    private AsyncRequestTracker asyncRequestTracker;
    @Mock
    private AsyncRequestWorker asyncRequestWorker;
    @Mock
    private RedisService redisService;

    private final MovableClock clock = new MovableClock(LAUNCH);
    private Schedule schedule;
    private ScheduleRunner runner;

    @BeforeEach
    void setup() {
        ScheduleTimeline timeline = new ScheduleTimeline(new RecurrenceCalculator(), clock);
        ScheduleTxService txService = new ScheduleTxService(scheduleMapper, timeline, asyncRequestTracker);
        runner = new ScheduleRunner(scheduleMapper, txService, selectionResolver, asyncRequestWorker, redisService,
                new JsonColumnService(new ObjectMapper()), new ScheduleProperties(), clock);

        schedule = new Schedule();
        schedule.setId(11L);
        schedule.setFarmId(7L);
        schedule.setCreatedBy(3L);
        schedule.setTargetTagIds("[5]");
        schedule.setTargetTagMatch(TagMatch.ANY);
        schedule.setAction("{\"flightSheetId\":9}");
        schedule.setLaunchAt(LAUNCH);
        schedule.setRrule("FREQ=HOURLY;COUNT=3");
        schedule.setActive(true);
        schedule.setNextLaunchAt(LAUNCH);

        when(scheduleMapper.findById(11L)).thenAnswer(inv -> Optional.of(schedule));
        // 游标 CAS：只有 next_launch_at 仍等于预期值时才推进
        when(scheduleMapper.advance(eq(11L), any(), any(), anyBoolean(), any(), any())).thenAnswer(inv -> {
            LocalDateTime expected = inv.getArgument(1);
            if (!schedule.getActive() || !Objects.equals(expected, schedule.getNextLaunchAt())) {
                return 0;
            }
            schedule.setPrevLaunchAt(expected);
            schedule.setNextLaunchAt(inv.getArgument(2));
            schedule.setActive(inv.getArgument(3));
            return 1;
        });
        when(redisService.tryAcquireLease(anyString(), anyString(), any())).thenReturn(true);
        when(selectionResolver.resolve(eq(7L), eq(3L), any())).thenReturn(List.of(1L, 2L));
        when(asyncRequestTracker.create(eq(3L), eq(FleetActionService.ASYNC_OPERATION), any())).thenReturn("req");
    }

    @Test
    void countedRule_firesExactlyThreeTimesThenDeactivates() {
        assertTrue(runner.fire(11L));
        assertEquals(LAUNCH.plusHours(1), schedule.getNextLaunchAt());

        clock.set(LAUNCH.plusHours(1));
        assertTrue(runner.fire(11L));
        clock.set(LAUNCH.plusHours(2));
        assertTrue(runner.fire(11L));

        assertFalse(schedule.getActive());
        assertNull(schedule.getNextLaunchAt());

        clock.set(LAUNCH.plusHours(3));
        assertFalse(runner.fire(11L));

        verify(asyncRequestTracker, times(3)).create(eq(3L), eq(FleetActionService.ASYNC_OPERATION), any());
        verify(asyncRequestWorker, times(3)).submit("req");
        verify(redisService, times(4)).releaseLease(eq("fleet:schedule:lease:11"), anyString());
    }

    @Test
    void dailyCountThree_firesOnThreeDaysThenDeactivates() {
        schedule.setRrule("FREQ=DAILY;COUNT=3");

        assertTrue(runner.fire(11L));
        assertEquals(LAUNCH.plusDays(1), schedule.getNextLaunchAt());

        clock.set(LAUNCH.plusDays(1));
        assertTrue(runner.fire(11L));
        assertEquals(LAUNCH.plusDays(2), schedule.getNextLaunchAt());

        clock.set(LAUNCH.plusDays(2));
        assertTrue(runner.fire(11L));

        assertFalse(schedule.getActive());
        assertNull(schedule.getNextLaunchAt());

        clock.set(LAUNCH.plusDays(3));
        assertFalse(runner.fire(11L));

        verify(asyncRequestTracker, times(3)).create(eq(3L), eq(FleetActionService.ASYNC_OPERATION), any());
        verify(asyncRequestWorker, times(3)).submit("req");
    }

    @Test
    void notYetDue_doesNotFire() {
        clock.set(LAUNCH.minusSeconds(1));

        assertFalse(runner.fire(11L));

        verify(scheduleMapper, never()).advance(any(), any(), any(), anyBoolean(), any(), any());
    }

    @Test
    void leaseHeldElsewhere_doesNotFire() {
        when(redisService.tryAcquireLease(anyString(), anyString(), any())).thenReturn(false);

        assertFalse(runner.fire(11L));

        verify(scheduleMapper, never()).findById(any());
        verify(redisService, never()).releaseLease(anyString(), anyString());
    }

    @Test
    void missedOccurrences_coalesceIntoOneFire() {
        schedule.setRrule("FREQ=HOURLY");
        clock.set(LAUNCH.plusHours(5).plusMinutes(10));

        assertTrue(runner.fire(11L));

        verify(asyncRequestTracker, times(1)).create(any(), any(), any());
        assertEquals(LAUNCH.plusHours(6), schedule.getNextLaunchAt());
    }

    @Test
    void unresolvableTarget_advancesWithoutRequest() {
        schedule.setTargetTagIds(null);
        schedule.setTargetContainerId(40L);
        when(selectionResolver.resolve(eq(7L), eq(3L), any())).thenThrow(NotFoundException.of("容器", 40L));

        assertTrue(runner.fire(11L));

        verify(asyncRequestTracker, never()).create(any(), any(), any());
        verify(asyncRequestWorker, never()).submit(any());
        assertEquals(LAUNCH.plusHours(1), schedule.getNextLaunchAt());
    }

    @Test
    void oneShot_firesOnceAndDeactivates() {
        schedule.setRrule(null);
        clock.set(LAUNCH.plusMinutes(3));

        assertTrue(runner.fire(11L));

        assertFalse(schedule.getActive());
        assertNull(schedule.getNextLaunchAt());
    }

    @Test
    void tick_continuesAfterFailure() {
        when(scheduleMapper.findDueIds(any(), anyInt())).thenReturn(List.of(10L, 11L));
        when(scheduleMapper.findById(10L)).thenThrow(new IllegalStateException("boom"));

        runner.tick();

        verify(asyncRequestWorker).submit("req");
    }

    private static final class MovableClock extends Clock {
        private Instant now;

        MovableClock(LocalDateTime start) {
            set(start);
        }

        void set(LocalDateTime time) {
            this.now = time.atZone(ZONE).toInstant();
        }

        @Override
        public ZoneId getZone() {
            return ZONE;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
