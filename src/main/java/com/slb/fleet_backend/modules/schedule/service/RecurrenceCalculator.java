package com.slb.fleet_backend.modules.schedule.service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.slb.fleet_backend.modules.schedule.domain.RecurrenceRule;
import com.slb.fleet_backend.modules.schedule.domain.WeekdayNum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * 重复规则的触发时间计算，纯函数：给定规则、首次时间（DTSTART，带时区）与参考时间，求下一次/上一次触发。
 *
 * <p>DTSTART 本身总是第一次触发；COUNT 从 DTSTART 开始计数；UNTIL 包含边界。
 * 按周期（小时/天/周/月/年）逐个展开候选时间，周期数有上限，超过视为没有后续触发。</p>
 */
@Component
@Slf4j
public class RecurrenceCalculator {

    static final int MAX_PERIODS = 100_000;

    private final Cache<String, RecurrenceRule> ruleCache = CacheBuilder.newBuilder()
            .maximumSize(1024)
            .expireAfterAccess(1, TimeUnit.HOURS)
            .build();

    /**
     * 解析（带缓存）。格式错误抛 ValidationException。
     */
    public RecurrenceRule parse(String rrule) {
        String key = rrule.trim();
        RecurrenceRule cached = ruleCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        RecurrenceRule parsed = RecurrenceRule.parse(key);
        ruleCache.put(key, parsed);
        return parsed;
    }

    /**
     * 严格晚于 after 的第一次触发；没有则为空。
     */
    public Optional<ZonedDateTime> nextOccurrence(RecurrenceRule rule, ZonedDateTime dtStart, ZonedDateTime after) {
        ZonedDateTime[] found = new ZonedDateTime[1];
        ZonedDateTime afterInZone = after.withZoneSameInstant(dtStart.getZone());
        iterate(rule, dtStart, skipHint(rule, dtStart, afterInZone), occurrence -> {
            if (occurrence.isAfter(afterInZone)) {
                found[0] = occurrence;
                return false;
            }
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    /**
     * 严格早于 before 的最后一次触发；没有则为空。
     */
    public Optional<ZonedDateTime> previousOccurrence(RecurrenceRule rule, ZonedDateTime dtStart, ZonedDateTime before) {
        ZonedDateTime[] found = new ZonedDateTime[1];
        ZonedDateTime beforeInZone = before.withZoneSameInstant(dtStart.getZone());
        iterate(rule, dtStart, 0, occurrence -> {
            if (!occurrence.isBefore(beforeInZone)) {
                return false;
            }
            found[0] = occurrence;
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    /**
     * 严格晚于 after 的前 limit 次触发，用于预览
     */
    public List<ZonedDateTime> upcoming(RecurrenceRule rule, ZonedDateTime dtStart, ZonedDateTime after, int limit) {
        List<ZonedDateTime> result = new ArrayList<>();
        if (limit <= 0) {
            return result;
        }
        ZonedDateTime afterInZone = after.withZoneSameInstant(dtStart.getZone());
        iterate(rule, dtStart, skipHint(rule, dtStart, afterInZone), occurrence -> {
            if (occurrence.isAfter(afterInZone)) {
                result.add(occurrence);
            }
            return result.size() < limit;
        });
        return result;
    }

    /**
     * 没有 COUNT 时，after 之前的整周期可以直接跳过，避免从很久以前的 DTSTART 逐周期展开。
     */
    private long skipHint(RecurrenceRule rule, ZonedDateTime dtStart, ZonedDateTime after) {
        if (rule.getCount() != null || !after.isAfter(dtStart)) {
            return 0;
        }
        LocalDateTime start = dtStart.toLocalDateTime();
        LocalDateTime target = after.toLocalDateTime();
        long units = switch (rule.getFrequency()) {
            case HOURLY -> ChronoUnit.HOURS.between(start.truncatedTo(ChronoUnit.HOURS), target);
            case DAILY -> ChronoUnit.DAYS.between(start.toLocalDate(), target.toLocalDate());
            case WEEKLY -> ChronoUnit.WEEKS.between(weekBase(rule, start.toLocalDate()), target.toLocalDate());
            case MONTHLY -> ChronoUnit.MONTHS.between(YearMonth.from(start), YearMonth.from(target));
            case YEARLY -> (long) target.getYear() - start.getYear();
        };
        return Math.max(0, units / rule.getInterval() - 1);
    }

    private void iterate(RecurrenceRule rule, ZonedDateTime dtStart, long firstPeriod, Predicate<ZonedDateTime> visitor) {
        ZoneId zone = dtStart.getZone();
        LocalDateTime start = dtStart.toLocalDateTime().withNano(0);
        LocalDateTime until = rule.hasUntil() ? rule.untilIn(zone) : null;
        Integer count = rule.getCount();
        int emitted = 0;

        if (firstPeriod == 0) {
            if (until != null && start.isAfter(until)) {
                return;
            }
            emitted++;
            if (!visitor.test(ZonedDateTime.of(start, zone))) {
                return;
            }
            if (count != null && emitted >= count) {
                return;
            }
        }
        for (long period = firstPeriod; period < firstPeriod + MAX_PERIODS; period++) {
            for (LocalDateTime candidate : expand(rule, start, period)) {
                if (!candidate.isAfter(start)) {
                    continue;
                }
                if (until != null && candidate.isAfter(until)) {
                    return;
                }
                emitted++;
                if (!visitor.test(ZonedDateTime.of(candidate, zone))) {
                    return;
                }
                if (count != null && emitted >= count) {
                    return;
                }
            }
        }
        log.warn("Recurrence expansion reached {} periods without finishing, rule={}", MAX_PERIODS, rule.getSource());
    }

    /**
     * 第 period 个周期内的全部候选时间（升序）
     */
    private Set<LocalDateTime> expand(RecurrenceRule rule, LocalDateTime start, long period) {
        long step = period * rule.getInterval();
        Set<LocalDateTime> out = new TreeSet<>();
        switch (rule.getFrequency()) {
            case HOURLY -> {
                LocalDateTime hour = start.truncatedTo(ChronoUnit.HOURS).plusHours(step);
                if (dayMatches(rule, hour.toLocalDate())
                        && (rule.getByHour().isEmpty() || rule.getByHour().contains(hour.getHour()))) {
                    for (int minute : minutes(rule, start)) {
                        out.add(hour.withMinute(minute).withSecond(start.getSecond()));
                    }
                }
            }
            case DAILY -> {
                LocalDate date = start.toLocalDate().plusDays(step);
                if (dayMatches(rule, date)) {
                    addTimes(out, rule, start, date);
                }
            }
            case WEEKLY -> {
                LocalDate weekStart = weekBase(rule, start.toLocalDate()).plusWeeks(step);
                for (int i = 0; i < 7; i++) {
                    LocalDate date = weekStart.plusDays(i);
                    boolean dayOk = rule.getByDay().isEmpty()
                            ? date.getDayOfWeek() == start.getDayOfWeek()
                            : rule.getByDay().stream().anyMatch(w -> w.day() == date.getDayOfWeek());
                    if (dayOk && monthMatches(rule, date)) {
                        addTimes(out, rule, start, date);
                    }
                }
            }
            case MONTHLY -> {
                YearMonth month = YearMonth.from(start).plusMonths(step);
                if (rule.getByMonth().isEmpty() || rule.getByMonth().contains(month.getMonthValue())) {
                    for (LocalDate date : monthDays(rule, month, start)) {
                        addTimes(out, rule, start, date);
                    }
                }
            }
            case YEARLY -> {
                int year = Math.addExact(start.getYear(), Math.toIntExact(step));
                for (LocalDate date : yearDays(rule, year, start)) {
                    addTimes(out, rule, start, date);
                }
            }
        }
        return out;
    }

    private List<LocalDate> yearDays(RecurrenceRule rule, int year, LocalDateTime start) {
        List<LocalDate> days = new ArrayList<>();
        if (!rule.getByMonth().isEmpty()) {
            for (int month : rule.getByMonth()) {
                days.addAll(monthDays(rule, YearMonth.of(year, month), start));
            }
        } else if (!rule.getByDay().isEmpty()) {
            // 无 BYMONTH 时 BYDAY 的序号按全年计算
            LocalDate first = LocalDate.of(year, 1, 1);
            LocalDate last = LocalDate.of(year, 12, 31);
            Set<LocalDate> byDay = weekdaysInRange(rule.getByDay(), first, last);
            for (LocalDate date : byDay) {
                if (rule.getByMonthDay().isEmpty() || monthDayMatches(rule, date)) {
                    days.add(date);
                }
            }
        } else if (!rule.getByMonthDay().isEmpty()) {
            for (int month = 1; month <= 12; month++) {
                days.addAll(monthDays(rule, YearMonth.of(year, month), start));
            }
        } else {
            YearMonth month = YearMonth.of(year, start.getMonthValue());
            if (month.isValidDay(start.getDayOfMonth())) {
                days.add(month.atDay(start.getDayOfMonth()));
            }
        }
        return days;
    }

    private List<LocalDate> monthDays(RecurrenceRule rule, YearMonth month, LocalDateTime start) {
        Set<LocalDate> result = new TreeSet<>();
        boolean hasMonthDay = !rule.getByMonthDay().isEmpty();
        boolean hasDay = !rule.getByDay().isEmpty();
        if (!hasMonthDay && !hasDay) {
            if (month.isValidDay(start.getDayOfMonth())) {
                result.add(month.atDay(start.getDayOfMonth()));
            }
            return new ArrayList<>(result);
        }
        Set<LocalDate> byMonthDay = new TreeSet<>();
        for (int day : rule.getByMonthDay()) {
            int resolved = day > 0 ? day : month.lengthOfMonth() + 1 + day;
            if (resolved >= 1 && month.isValidDay(resolved)) {
                byMonthDay.add(month.atDay(resolved));
            }
        }
        Set<LocalDate> byDay = hasDay
                ? weekdaysInRange(rule.getByDay(), month.atDay(1), month.atEndOfMonth())
                : Set.of();
        if (hasMonthDay && hasDay) {
            byMonthDay.retainAll(byDay);
            result.addAll(byMonthDay);
        } else if (hasMonthDay) {
            result.addAll(byMonthDay);
        } else {
            result.addAll(byDay);
        }
        return new ArrayList<>(result);
    }

    /**
     * 区间内匹配 BYDAY 的日期；带序号的取区间内第 n 个（负数从末尾数）
     */
    private Set<LocalDate> weekdaysInRange(List<WeekdayNum> byDay, LocalDate first, LocalDate last) {
        Set<LocalDate> result = new TreeSet<>();
        for (WeekdayNum weekday : byDay) {
            List<LocalDate> matches = new ArrayList<>();
            for (LocalDate d = first.with(TemporalAdjusters.nextOrSame(weekday.day())); !d.isAfter(last); d = d.plusWeeks(1)) {
                matches.add(d);
            }
            if (!weekday.hasOrdinal()) {
                result.addAll(matches);
            } else {
                int index = weekday.ordinal() > 0 ? weekday.ordinal() - 1 : matches.size() + weekday.ordinal();
                if (index >= 0 && index < matches.size()) {
                    result.add(matches.get(index));
                }
            }
        }
        return result;
    }

    /**
     * HOURLY/DAILY 下 BYMONTH/BYMONTHDAY/BYDAY 作为过滤条件
     */
    private boolean dayMatches(RecurrenceRule rule, LocalDate date) {
        if (!monthMatches(rule, date)) {
            return false;
        }
        if (!rule.getByMonthDay().isEmpty() && !monthDayMatches(rule, date)) {
            return false;
        }
        DayOfWeek dow = date.getDayOfWeek();
        return rule.getByDay().isEmpty() || rule.getByDay().stream().anyMatch(w -> w.day() == dow);
    }

    private boolean monthMatches(RecurrenceRule rule, LocalDate date) {
        return rule.getByMonth().isEmpty() || rule.getByMonth().contains(date.getMonthValue());
    }

    private boolean monthDayMatches(RecurrenceRule rule, LocalDate date) {
        int length = date.lengthOfMonth();
        for (int day : rule.getByMonthDay()) {
            int resolved = day > 0 ? day : length + 1 + day;
            if (resolved == date.getDayOfMonth()) {
                return true;
            }
        }
        return false;
    }

    private void addTimes(Set<LocalDateTime> out, RecurrenceRule rule, LocalDateTime start, LocalDate date) {
        List<Integer> hours = rule.getByHour().isEmpty() ? List.of(start.getHour()) : rule.getByHour();
        for (int hour : hours) {
            for (int minute : minutes(rule, start)) {
                out.add(date.atTime(hour, minute, start.getSecond()));
            }
        }
    }

    private List<Integer> minutes(RecurrenceRule rule, LocalDateTime start) {
        return rule.getByMinute().isEmpty() ? List.of(start.getMinute()) : rule.getByMinute();
    }

    private LocalDate weekBase(RecurrenceRule rule, LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(rule.getWeekStart()));
    }
}
