package com.slb.fleet_backend.modules.command.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 对一批设备执行的动作：可选飞行表、可选超频、零到多条指令，至少有一项。
 */
@Data
public class FleetAction {

    @Schema(description = "要应用的飞行表ID")
    private Long flightSheetId;

    @Schema(description = "超频下发")
    private OverclockAction overclock;

    @Schema(description = "附加指令，按顺序入队")
    private List<CommandSpec> commands = new ArrayList<>();

    @JsonIgnore
    public boolean isEmpty() {
        return flightSheetId == null && overclock == null && (commands == null || commands.isEmpty());
    }
}
