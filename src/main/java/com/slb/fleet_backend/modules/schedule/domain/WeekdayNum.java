package com.slb.fleet_backend.modules.schedule.domain;

import java.time.DayOfWeek;

/**
 * BYDAY 的一项，如 MO、2TU、-1FR。ordinal 为 0 表示不限第几个。
 */
public record WeekdayNum(int ordinal, DayOfWeek day) {

    public boolean hasOrdinal() {
        return ordinal != 0;
    }
}
