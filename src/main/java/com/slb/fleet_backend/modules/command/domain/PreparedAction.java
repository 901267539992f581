package com.slb.fleet_backend.modules.command.domain;

import com.slb.fleet_backend.modules.flightsheet.entity.FlightSheet;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcProfile;
import com.slb.fleet_backend.modules.overclock.enums.OcApplyMode;

import java.util.List;

/**
 * 批量执行前预先加载、校验好的动作，批内每台设备共用。
 * 超频来源 ocProfile 与 inlineOc 至多一个非空。
 */
public record PreparedAction(
        Long farmId,
        FlightSheet flightSheet,
        OcProfile ocProfile,
        OcConfig inlineOc,
        OcApplyMode ocMode,
        List<ValidatedCommand> commands
) {

    public boolean hasOverclock() {
        return ocProfile != null || inlineOc != null;
    }
}
