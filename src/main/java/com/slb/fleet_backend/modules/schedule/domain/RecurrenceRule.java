package com.slb.fleet_backend.modules.schedule.domain;

import com.slb.fleet_backend.common.exception.ValidationException;
import com.slb.fleet_backend.modules.schedule.enums.Frequency;
import lombok.Getter;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析后的 iCalendar RRULE（RFC 5545 子集）。
 *
 * <p>支持 FREQ（HOURLY/DAILY/WEEKLY/MONTHLY/YEARLY）、INTERVAL、COUNT、UNTIL、BYDAY、BYMONTHDAY、
 * BYMONTH、BYHOUR、BYMINUTE、WKST。COUNT 与 UNTIL 不能同时出现。
 * UNTIL 可以是 UTC 时间（...Z）、本地时间或日期；本地时间与日期按计划所在时区解释，日期包含当天。</p>
 */
@Getter
public final class RecurrenceRule {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern BYDAY_ITEM = Pattern.compile("^([+-]?\\d{1,2})?(MO|TU|WE|TH|FR|SA|SU)$");
    private static final Map<String, DayOfWeek> DAYS = Map.of(
            "MO", DayOfWeek.MONDAY, "TU", DayOfWeek.TUESDAY, "WE", DayOfWeek.WEDNESDAY,
            "TH", DayOfWeek.THURSDAY, "FR", DayOfWeek.FRIDAY, "SA", DayOfWeek.SATURDAY, "SU", DayOfWeek.SUNDAY);

    private final String source;
    private final Frequency frequency;
    private final int interval;
    private final Integer count;
    // UNTIL 为 UTC 时间时 untilUtc 非空，否则 untilLocal 非空（按计划时区解释）
    private final LocalDateTime untilUtc;
    private final LocalDateTime untilLocal;
    private final List<WeekdayNum> byDay;
    private final List<Integer> byMonthDay;
    private final List<Integer> byMonth;
    private final List<Integer> byHour;
    private final List<Integer> byMinute;
    private final DayOfWeek weekStart;

    private RecurrenceRule(String source, Frequency frequency, int interval, Integer count,
                           LocalDateTime untilUtc, LocalDateTime untilLocal,
                           List<WeekdayNum> byDay, List<Integer> byMonthDay, List<Integer> byMonth,
                           List<Integer> byHour, List<Integer> byMinute, DayOfWeek weekStart) {
        this.source = source;
        this.frequency = frequency;
        this.interval = interval;
        this.count = count;
        this.untilUtc = untilUtc;
        this.untilLocal = untilLocal;
        this.byDay = Collections.unmodifiableList(byDay);
        this.byMonthDay = Collections.unmodifiableList(byMonthDay);
        this.byMonth = Collections.unmodifiableList(byMonth);
        this.byHour = Collections.unmodifiableList(byHour);
        this.byMinute = Collections.unmodifiableList(byMinute);
        this.weekStart = weekStart;
    }

    /**
     * 解析规则串，可带 "RRULE:" 前缀；格式错误抛 ValidationException（字段 rrule）。
     */
    public static RecurrenceRule parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid("重复规则不能为空");
        }
        String text = raw.trim();
        if (text.regionMatches(true, 0, "RRULE:", 0, 6)) {
            text = text.substring(6);
        }
        Frequency frequency = null;
        int interval = 1;
        Integer count = null;
        LocalDateTime untilUtc = null;
        LocalDateTime untilLocal = null;
        List<WeekdayNum> byDay = new ArrayList<>();
        List<Integer> byMonthDay = new ArrayList<>();
        List<Integer> byMonth = new ArrayList<>();
        List<Integer> byHour = new ArrayList<>();
        List<Integer> byMinute = new ArrayList<>();
        DayOfWeek weekStart = DayOfWeek.MONDAY;
        Set<String> seen = new HashSet<>();

        for (String part : text.split(";")) {
            if (part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq <= 0 || eq == part.length() - 1) {
                throw invalid("无法识别的规则片段: " + part);
            }
            String name = part.substring(0, eq).trim().toUpperCase(Locale.ROOT);
            String value = part.substring(eq + 1).trim().toUpperCase(Locale.ROOT);
            if (!seen.add(name)) {
                throw invalid("规则片段重复: " + name);
            }
            switch (name) {
                case "FREQ" -> {
                    try {
                        frequency = Frequency.valueOf(value);
                    } catch (IllegalArgumentException e) {
                        throw invalid("不支持的 FREQ: " + value);
                    }
                }
                case "INTERVAL" -> interval = parseInt(name, value, 1, 10_000);
                case "COUNT" -> count = parseInt(name, value, 1, 100_000);
                case "UNTIL" -> {
                    if (value.endsWith("Z")) {
                        untilUtc = parseDateTime(value.substring(0, value.length() - 1));
                    } else if (value.contains("T")) {
                        untilLocal = parseDateTime(value);
                    } else {
                        untilLocal = parseDate(value).atTime(LocalTime.MAX);
                    }
                }
                case "BYDAY" -> {
                    for (String item : value.split(",")) {
                        Matcher m = BYDAY_ITEM.matcher(item.trim());
                        if (!m.matches()) {
                            throw invalid("BYDAY 取值错误: " + item);
                        }
                        int ordinal = m.group(1) == null ? 0 : Integer.parseInt(m.group(1).replace("+", ""));
                        if (ordinal < -53 || ordinal > 53) {
                            throw invalid("BYDAY 序号超出范围: " + item);
                        }
                        byDay.add(new WeekdayNum(ordinal, DAYS.get(m.group(2))));
                    }
                }
                case "BYMONTHDAY" -> byMonthDay.addAll(parseIntList(name, value, -31, 31, true));
                case "BYMONTH" -> byMonth.addAll(parseIntList(name, value, 1, 12, false));
                case "BYHOUR" -> byHour.addAll(parseIntList(name, value, 0, 23, false));
                case "BYMINUTE" -> byMinute.addAll(parseIntList(name, value, 0, 59, false));
                case "WKST" -> {
                    weekStart = DAYS.get(value);
                    if (weekStart == null) {
                        throw invalid("WKST 取值错误: " + value);
                    }
                }
                default -> throw invalid("不支持的规则片段: " + name);
            }
        }
        if (frequency == null) {
            throw invalid("缺少 FREQ");
        }
        if (count != null && (untilUtc != null || untilLocal != null)) {
            throw invalid("COUNT 与 UNTIL 不能同时使用");
        }
        boolean ordinalAllowed = frequency == Frequency.MONTHLY || frequency == Frequency.YEARLY;
        if (!ordinalAllowed && byDay.stream().anyMatch(WeekdayNum::hasOrdinal)) {
            throw invalid("仅 MONTHLY/YEARLY 支持带序号的 BYDAY");
        }
        return new RecurrenceRule(text, frequency, interval, count, untilUtc, untilLocal,
                byDay, byMonthDay, byMonth, byHour, byMinute, weekStart);
    }

    public boolean hasUntil() {
        return untilUtc != null || untilLocal != null;
    }

    /**
     * 把 UNTIL 转成计划时区下的本地时间
     */
    public LocalDateTime untilIn(java.time.ZoneId zone) {
        if (untilUtc != null) {
            return untilUtc.atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).toLocalDateTime();
        }
        return untilLocal;
    }

    private static int parseInt(String name, String value, int min, int max) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < min || parsed > max) {
                throw invalid(name + " 超出范围: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw invalid(name + " 必须是整数: " + value);
        }
    }

    private static List<Integer> parseIntList(String name, String value, int min, int max, boolean rejectZero) {
        List<Integer> values = new ArrayList<>();
        for (String item : value.split(",")) {
            int parsed = parseInt(name, item.trim().replace("+", ""), min, max);
            if (rejectZero && parsed == 0) {
                throw invalid(name + " 不能为 0");
            }
            if (!values.contains(parsed)) {
                values.add(parsed);
            }
        }
        return values;
    }

    private static LocalDateTime parseDateTime(String value) {
        try {
            return LocalDateTime.parse(value, DATE_TIME);
        } catch (DateTimeParseException e) {
            throw invalid("UNTIL 时间格式错误: " + value);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value, DATE);
        } catch (DateTimeParseException e) {
            throw invalid("UNTIL 日期格式错误: " + value);
        }
    }

    private static ValidationException invalid(String message) {
        return new ValidationException("rrule", message);
    }
}
