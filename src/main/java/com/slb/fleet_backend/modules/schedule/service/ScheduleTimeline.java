package com.slb.fleet_backend.modules.schedule.service;

import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.schedule.domain.RecurrenceRule;
import com.slb.fleet_backend.modules.schedule.entity.Schedule;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 计划的时间轴：服务端时区（落库）与计划时区（规则计算）之间的换算，以及游标的计算。
 */
@Component
public class ScheduleTimeline {

    private final RecurrenceCalculator calculator;
    private final Clock clock;

    public ScheduleTimeline(RecurrenceCalculator calculator, Clock clock) {
        this.calculator = calculator;
        this.clock = clock;
    }

    public ZoneId serverZone() {
        return clock.getZone();
    }

    /**
     * 计划时区；为空时用服务端时区。非法时区抛 ValidationException（字段 timezone）。
     */
    public ZoneId zoneOf(String timezone) {
        if (!StringUtils.hasText(timezone)) {
            return serverZone();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("timezone", "无法识别的时区: " + timezone);
        }
    }

    public RecurrenceRule ruleOf(Schedule schedule) {
        return StringUtils.hasText(schedule.getRrule()) ? calculator.parse(schedule.getRrule()) : null;
    }

    public LocalDateTime toServer(LocalDateTime local, ZoneId zone) {
        return local == null ? null : local.atZone(zone).withZoneSameInstant(serverZone()).toLocalDateTime();
    }

    public LocalDateTime fromServer(LocalDateTime server, ZoneId zone) {
        return server == null ? null : server.atZone(serverZone()).withZoneSameInstant(zone).toLocalDateTime();
    }

    /**
     * 严格晚于 after（服务端时区）的下一次触发；规则用尽或一次性计划返回空。
     */
    public Optional<LocalDateTime> nextAfter(Schedule schedule, LocalDateTime after) {
        RecurrenceRule rule = ruleOf(schedule);
        if (rule == null) {
            return schedule.getLaunchAt().isAfter(after) ? Optional.of(schedule.getLaunchAt()) : Optional.empty();
        }
        ZoneId zone = zoneOf(schedule.getTimezone());
        ZonedDateTime dtStart = schedule.getLaunchAt().atZone(serverZone()).withZoneSameInstant(zone);
        return calculator.nextOccurrence(rule, dtStart, after.atZone(serverZone()))
                .map(next -> next.withZoneSameInstant(serverZone()).toLocalDateTime());
    }

    /**
     * 新建/修改/重新启用时的游标：首次时间未到就是首次时间；已过时一次性计划尽快执行，
     * 重复计划取 now 之后的下一次。
     */
    public Optional<LocalDateTime> initialNext(Schedule schedule, LocalDateTime now) {
        if (!schedule.getLaunchAt().isBefore(now)) {
            return Optional.of(schedule.getLaunchAt());
        }
        if (ruleOf(schedule) == null) {
            return Optional.of(schedule.getLaunchAt());
        }
        return nextAfter(schedule, now);
    }

    /**
     * 预览：after 之后的 limit 次触发（计划时区）
     */
    public List<LocalDateTime> upcoming(Schedule schedule, LocalDateTime after, int limit) {
        ZoneId zone = zoneOf(schedule.getTimezone());
        RecurrenceRule rule = ruleOf(schedule);
        if (rule == null) {
            return schedule.getLaunchAt().isAfter(after) && limit > 0
                    ? List.of(fromServer(schedule.getLaunchAt(), zone))
                    : List.of();
        }
        ZonedDateTime dtStart = schedule.getLaunchAt().atZone(serverZone()).withZoneSameInstant(zone);
        return calculator.upcoming(rule, dtStart, after.atZone(serverZone()), limit).stream()
                .map(ZonedDateTime::toLocalDateTime)
                .toList();
    }
}
