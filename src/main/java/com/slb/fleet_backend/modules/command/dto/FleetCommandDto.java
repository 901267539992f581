package com.slb.fleet_backend.modules.command.dto;

import com.slb.fleet_backend.modules.command.domain.FleetAction;
import com.slb.fleet_backend.modules.selection.domain.SelectionSpec;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 批量下发请求：目标设备 + 动作
 */
@Data
public class FleetCommandDto {

    @NotNull(message = "缺少目标设备")
    @Schema(description = "目标设备选择条件")
    private SelectionSpec target;

    @NotNull(message = "缺少下发动作")
    @Schema(description = "下发动作：飞行表、超频、指令至少一项")
    private FleetAction action;
}
