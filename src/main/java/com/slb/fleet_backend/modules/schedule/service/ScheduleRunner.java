package com.slb.fleet_backend.modules.schedule.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.slb.fleet_backend.common.exception.BizException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.common.service.RedisService;
import com.slb.fleet_backend.modules.asyncreq.service.AsyncRequestWorker;
import com.slb.fleet_backend.modules.command.domain.FleetAction;
import com.slb.fleet_backend.modules.schedule.config.ScheduleProperties;
import com.slb.fleet_backend.modules.schedule.entity.Schedule;
import com.slb.fleet_backend.modules.schedule.mapper.ScheduleMapper;
import com.slb.fleet_backend.modules.selection.domain.SelectionSpec;
import com.slb.fleet_backend.modules.selection.service.SelectionResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 定时扫描到期计划并触发。多实例部署时靠 Redis 租约 + 游标 CAS 保证每个时间点只触发一次。
 */
@Component
@Slf4j
public class ScheduleRunner {

    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};

    private final ScheduleMapper scheduleMapper;
    private final ScheduleTxService txService;
    private final SelectionResolver selectionResolver;
    private final AsyncRequestWorker asyncRequestWorker;
    private final RedisService redisService;
    private final JsonColumnService jsonColumnService;
    private final ScheduleProperties properties;
    private final Clock clock;

    public ScheduleRunner(ScheduleMapper scheduleMapper,
                          ScheduleTxService txService,
                          SelectionResolver selectionResolver,
                          AsyncRequestWorker asyncRequestWorker,
                          RedisService redisService,
                          JsonColumnService jsonColumnService,
                          ScheduleProperties properties,
                          Clock clock) {
        this.scheduleMapper = scheduleMapper;
        this.txService = txService;
        this.selectionResolver = selectionResolver;
        this.asyncRequestWorker = asyncRequestWorker;
        this.redisService = redisService;
        this.jsonColumnService = jsonColumnService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.schedules.tick-ms:15000}")
    public void tick() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> dueIds = scheduleMapper.findDueIds(now, properties.getBatchSize());
        if (dueIds.isEmpty()) {
            return;
        }
        log.debug("Schedule tick at {}: {} due", now, dueIds.size());
        for (Long id : dueIds) {
            try {
                fire(id);
            } catch (BizException | DataAccessException ex) {
                log.warn("Schedule {} not fired this tick: {}", id, ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("Schedule {} failed", id, ex);
            }
        }
    }

    /**
     * 触发单个计划；计划已停用、已被推进或租约被他人持有时什么都不做。
     *
     * @return 是否完成了一次触发（含目标为空、只推进游标的情况）
     */
    public boolean fire(Long scheduleId) {
        String leaseKey = properties.getLeaseKeyPrefix() + ":" + scheduleId;
        String token = UUID.randomUUID().toString();
        if (!redisService.tryAcquireLease(leaseKey, token, properties.getLeaseTtl())) {
            log.debug("Schedule {} lease held elsewhere", scheduleId);
            return false;
        }
        try {
            Schedule schedule = scheduleMapper.findById(scheduleId).orElse(null);
            LocalDateTime now = LocalDateTime.now(clock);
            if (schedule == null || !Boolean.TRUE.equals(schedule.getActive())
                    || schedule.getNextLaunchAt() == null || schedule.getNextLaunchAt().isAfter(now)) {
                return false;
            }

            FleetAction action = jsonColumnService.read(schedule.getAction(), FleetAction.class);
            List<Long> deviceIds = resolveTargets(schedule);
            String requestId = txService.advanceAndSubmit(schedule, action, deviceIds, now);
            if (requestId != null) {
                asyncRequestWorker.submit(requestId);
            }
            return true;
        } finally {
            redisService.releaseLease(leaseKey, token);
        }
    }

    /**
     * 目标解析失败（如容器已删除）只记录日志，本次触发照常推进，不会卡住后续触发。
     */
    private List<Long> resolveTargets(Schedule schedule) {
        SelectionSpec spec = schedule.getTargetContainerId() != null
                ? SelectionSpec.ofContainer(schedule.getTargetContainerId())
                : SelectionSpec.ofTags(jsonColumnService.read(schedule.getTargetTagIds(), ID_LIST), schedule.getTargetTagMatch());
        try {
            return selectionResolver.resolve(schedule.getFarmId(), schedule.getCreatedBy(), spec);
        } catch (BizException ex) {
            log.warn("Schedule {} target could not be resolved, firing skipped: {}", schedule.getId(), ex.getMessage());
            return List.of();
        }
    }
}
