package com.slb.fleet_backend.modules.command.domain;

import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.enums.OcApplyMode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * 超频下发：ocId 与 config 二选一
 */
@Data
public class OverclockAction {

    @Schema(description = "超频方案ID，按设备当前算法解析")
    private Long ocId;

    @Schema(description = "直接给出的超频配置")
    private OcConfig config;

    @Schema(description = "REPLACE 整体替换（默认），MERGE 仅覆盖给出的字段")
    private OcApplyMode mode;
}
