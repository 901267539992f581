package com.slb.fleet_backend.modules.schedule.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.slb.fleet_backend.common.exception.ConflictException;
import com.slb.fleet_backend.common.exception.NotFoundException;
import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.common.service.JsonColumnService;
import com.slb.fleet_backend.modules.command.domain.FleetAction;
import com.slb.fleet_backend.modules.command.service.FleetActionService;
import com.slb.fleet_backend.modules.container.service.ContainerService;
import com.slb.fleet_backend.modules.schedule.config.ScheduleProperties;
import com.slb.fleet_backend.modules.schedule.dto.ScheduleSaveDto;
import com.slb.fleet_backend.modules.schedule.entity.Schedule;
import com.slb.fleet_backend.modules.schedule.mapper.ScheduleMapper;
import com.slb.fleet_backend.modules.schedule.vo.ScheduleVo;
import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 计划任务的维护：创建、修改、启停、删除、查询与触发时间预览。
 */
@Service
@Slf4j
public class ScheduleService {

    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};

    private final ScheduleMapper scheduleMapper;
    private final ScheduleTimeline timeline;
    private final FleetActionService fleetActionService;
    private final ContainerService containerService;
    private final JsonColumnService jsonColumnService;
    private final ScheduleProperties properties;
    private final Clock clock;

    public ScheduleService(ScheduleMapper scheduleMapper,
                           ScheduleTimeline timeline,
                           FleetActionService fleetActionService,
                           ContainerService containerService,
                           JsonColumnService jsonColumnService,
                           ScheduleProperties properties,
                           Clock clock) {
        this.scheduleMapper = scheduleMapper;
        this.timeline = timeline;
        this.fleetActionService = fleetActionService;
        this.containerService = containerService;
        this.jsonColumnService = jsonColumnService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public ScheduleVo create(Long farmId, Long operatorId, ScheduleSaveDto dto) {
        LocalDateTime now = LocalDateTime.now(clock);
        Schedule schedule = new Schedule();
        schedule.setFarmId(farmId);
        schedule.setCreatedBy(operatorId);
        schedule.setFireCount(0);
        schedule.setCreatedAt(now);
        fill(schedule, farmId, dto, now);
        scheduleMapper.insert(schedule);
        log.info("Created schedule {} in farm {}. rrule={}, next={}", schedule.getId(), farmId,
                schedule.getRrule(), schedule.getNextLaunchAt());
        return toVo(schedule);
    }

    @Transactional
    public ScheduleVo update(Long farmId, Long scheduleId, ScheduleSaveDto dto) {
        Schedule schedule = requireInFarm(farmId, scheduleId);
        fill(schedule, farmId, dto, LocalDateTime.now(clock));
        scheduleMapper.update(schedule);
        return toVo(schedule);
    }

    /**
     * 重新启用：从当前时间重新计算下一次触发，没有后续触发时拒绝。
     */
    @Transactional
    public ScheduleVo activate(Long farmId, Long scheduleId) {
        Schedule schedule = requireInFarm(farmId, scheduleId);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime next = firstPendingOccurrence(schedule, now)
                .orElseThrow(() -> new ConflictException("计划已没有后续触发时间，无法启用"));
        scheduleMapper.updateActivation(scheduleId, true, next, now);
        schedule.setActive(true);
        schedule.setNextLaunchAt(next);
        schedule.setUpdatedAt(now);
        return toVo(schedule);
    }

    /**
     * 停用在下一次 tick 前生效；正在触发中的那一次不受影响。
     */
    @Transactional
    public ScheduleVo deactivate(Long farmId, Long scheduleId) {
        Schedule schedule = requireInFarm(farmId, scheduleId);
        LocalDateTime now = LocalDateTime.now(clock);
        scheduleMapper.updateActivation(scheduleId, false, schedule.getNextLaunchAt(), now);
        schedule.setActive(false);
        schedule.setUpdatedAt(now);
        return toVo(schedule);
    }

    @Transactional
    public void delete(Long farmId, Long scheduleId) {
        requireInFarm(farmId, scheduleId);
        scheduleMapper.deleteById(scheduleId);
        log.info("Deleted schedule {} in farm {}", scheduleId, farmId);
    }

    public ScheduleVo get(Long farmId, Long scheduleId) {
        return toVo(requireInFarm(farmId, scheduleId));
    }

    public List<ScheduleVo> list(Long farmId) {
        List<ScheduleVo> result = new ArrayList<>();
        for (Schedule schedule : scheduleMapper.findByFarmId(farmId)) {
            result.add(toVo(schedule));
        }
        return result;
    }

    /**
     * 预览接下来的触发时间（计划时区）
     */
    public List<LocalDateTime> preview(Long farmId, Long scheduleId, int limit) {
        Schedule schedule = requireInFarm(farmId, scheduleId);
        int capped = Math.min(Math.max(limit, 1), properties.getMaxPreview());
        LocalDateTime from = LocalDateTime.now(clock);
        if (schedule.getPrevLaunchAt() != null && schedule.getPrevLaunchAt().isAfter(from)) {
            from = schedule.getPrevLaunchAt();
        }
        return timeline.upcoming(schedule, from, capped);
    }

    private void fill(Schedule schedule, Long farmId, ScheduleSaveDto dto, LocalDateTime now) {
        validateTarget(farmId, dto);
        fleetActionService.prepare(farmId, dto.getAction());
        ZoneId zone = timeline.zoneOf(dto.getTimezone());

        schedule.setName(dto.getName().trim());
        if (dto.getTagIds() != null) {
            schedule.setTargetTagIds(jsonColumnService.write(new ArrayList<>(new LinkedHashSet<>(dto.getTagIds()))));
            schedule.setTargetTagMatch(dto.getTagMatch() == null ? TagMatch.ANY : dto.getTagMatch());
            schedule.setTargetContainerId(null);
        } else {
            schedule.setTargetTagIds(null);
            schedule.setTargetTagMatch(null);
            schedule.setTargetContainerId(dto.getContainerId());
        }
        schedule.setAction(jsonColumnService.write(dto.getAction()));
        schedule.setRrule(StringUtils.hasText(dto.getRrule()) ? dto.getRrule().trim() : null);
        schedule.setTimezone(zone.getId());
        schedule.setLaunchAt(timeline.toServer(dto.getLaunchAt(), zone));
        // 规则在这里解析一次，格式错误直接返回 400
        timeline.ruleOf(schedule);

        boolean wantActive = dto.getActive() == null || dto.getActive();
        Optional<LocalDateTime> next = firstPendingOccurrence(schedule, now);
        if (wantActive && next.isEmpty()) {
            throw new ValidationException("rrule", "按该规则已没有后续触发时间");
        }
        schedule.setActive(wantActive);
        schedule.setNextLaunchAt(next.orElse(null));
        schedule.setUpdatedAt(now);
    }

    private Optional<LocalDateTime> firstPendingOccurrence(Schedule schedule, LocalDateTime now) {
        if (schedule.getPrevLaunchAt() == null) {
            return timeline.initialNext(schedule, now);
        }
        // 已触发过：不再重复已经执行过的时间点
        LocalDateTime after = schedule.getPrevLaunchAt().isAfter(now) ? schedule.getPrevLaunchAt() : now;
        return timeline.nextAfter(schedule, after);
    }

    private void validateTarget(Long farmId, ScheduleSaveDto dto) {
        boolean hasTags = dto.getTagIds() != null;
        boolean hasContainer = dto.getContainerId() != null;
        if (hasTags == hasContainer) {
            throw new ValidationException("target", "tagIds 与 containerId 必须且只能填写一个");
        }
        if (hasTags && (dto.getTagIds().isEmpty() || dto.getTagIds().stream().anyMatch(Objects::isNull))) {
            throw new ValidationException("tagIds", "标签ID列表不能为空且不能包含空值");
        }
        if (hasContainer) {
            containerService.get(farmId, dto.getContainerId());
        }
    }

    private Schedule requireInFarm(Long farmId, Long scheduleId) {
        Schedule schedule = scheduleMapper.findById(scheduleId)
                .orElseThrow(() -> NotFoundException.of("计划", scheduleId));
        if (!Objects.equals(schedule.getFarmId(), farmId)) {
            throw NotFoundException.of("计划", scheduleId);
        }
        return schedule;
    }

    private ScheduleVo toVo(Schedule schedule) {
        ZoneId zone = timeline.zoneOf(schedule.getTimezone());
        ScheduleVo vo = new ScheduleVo();
        vo.setId(schedule.getId());
        vo.setFarmId(schedule.getFarmId());
        vo.setName(schedule.getName());
        vo.setTagIds(jsonColumnService.read(schedule.getTargetTagIds(), ID_LIST));
        vo.setTagMatch(schedule.getTargetTagMatch());
        vo.setContainerId(schedule.getTargetContainerId());
        vo.setAction(jsonColumnService.read(schedule.getAction(), FleetAction.class));
        vo.setLaunchAt(timeline.fromServer(schedule.getLaunchAt(), zone));
        vo.setRrule(schedule.getRrule());
        vo.setTimezone(zone.getId());
        vo.setActive(schedule.getActive());
        vo.setPrevLaunchAt(timeline.fromServer(schedule.getPrevLaunchAt(), zone));
        vo.setNextLaunchAt(timeline.fromServer(schedule.getNextLaunchAt(), zone));
        vo.setFireCount(schedule.getFireCount());
        vo.setLastRequestId(schedule.getLastRequestId());
        vo.setUpdatedAt(schedule.getUpdatedAt());
        return vo;
    }
}
