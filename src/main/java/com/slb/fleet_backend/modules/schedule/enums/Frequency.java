package com.slb.fleet_backend.modules.schedule.enums;

/**
 * RRULE 的 FREQ
 */
public enum Frequency {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY
}
