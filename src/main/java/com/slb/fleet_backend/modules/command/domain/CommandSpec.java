package com.slb.fleet_backend.modules.command.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 运维提交的单条指令（未校验）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandSpec {

    @Schema(description = "指令类型：reboot / shutdown / upgrade / miner / exec / rom_flash / config_apply", example = "miner")
    private String type;

    @Schema(description = "指令参数，按类型不同：miner 需 action，exec 需 command，rom_flash 需 gpus 与 url，upgrade 可选 version",
            example = "{\"action\": \"restart\"}")
    private Map<String, Object> payload;
}
