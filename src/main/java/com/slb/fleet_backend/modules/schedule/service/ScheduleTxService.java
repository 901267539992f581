package com.slb.fleet_backend.modules.schedule.service;

import com.slb.fleet_backend.common.exception.ConflictException;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncRequestTracker;
import com.slb.fleet_backend.modules.command.domain.FleetAction;
import com.slb.fleet_backend.modules.command.domain.FleetActionJob;
import com.slb.fleet_backend.modules.command.service.FleetActionService;
import com.slb.fleet_backend.modules.schedule.entity.Schedule;
import com.slb.fleet_backend.modules.schedule.mapper.ScheduleMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 单次触发的事务部分：登记异步请求并推进游标，两者同成同败。
 */
@Service
@Slf4j
public class ScheduleTxService {

    private final ScheduleMapper scheduleMapper;
    private final ScheduleTimeline timeline;
    private final AsyncRequestTracker asyncRequestTracker;

    public ScheduleTxService(ScheduleMapper scheduleMapper,
                             ScheduleTimeline timeline,
                             AsyncRequestTracker asyncRequestTracker) {
        this.scheduleMapper = scheduleMapper;
        this.timeline = timeline;
        this.asyncRequestTracker = asyncRequestTracker;
    }

    /**
     * @param deviceIds 本次解析出的目标设备，为空时不登记请求，只推进游标
     * @return 登记的异步请求ID，未登记时为 null
     */
    @Transactional
    public String advanceAndSubmit(Schedule schedule, FleetAction action, List<Long> deviceIds, LocalDateTime now) {
        LocalDateTime expectedNext = schedule.getNextLaunchAt();

        String requestId = null;
        if (deviceIds != null && !deviceIds.isEmpty()) {
            FleetActionJob job = new FleetActionJob(schedule.getFarmId(), deviceIds, action);
            requestId = asyncRequestTracker.create(schedule.getCreatedBy(), FleetActionService.ASYNC_OPERATION, job);
        }

        // 错过的多次触发合并为一次
        LocalDateTime cursor = expectedNext.isAfter(now) ? expectedNext : now;
        Optional<LocalDateTime> next = timeline.nextAfter(schedule, cursor);
        int updated = scheduleMapper.advance(schedule.getId(), expectedNext, next.orElse(null),
                next.isPresent(), requestId, now);
        if (updated != 1) {
            throw new ConflictException("计划已被其他节点推进: " + schedule.getId());
        }

        log.info("Schedule {} fired at {} (due {}). request={}, devices={}, next={}",
                schedule.getId(), now, expectedNext, requestId,
                deviceIds == null ? 0 : deviceIds.size(), next.orElse(null));
        return requestId;
    }
}
