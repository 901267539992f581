package com.slb.fleet_backend.modules.command.domain;

import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OVERCLOCK_APPLY 指令载荷：解析后的完整超频配置及其对应算法
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OverclockPayload {
    private OcConfig config;
    private String algo;
}
