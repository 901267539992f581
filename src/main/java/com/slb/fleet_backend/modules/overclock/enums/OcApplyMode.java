package com.slb.fleet_backend.modules.overclock.enums;

/**
 * 超频下发到设备时的应用方式
 */
public enum OcApplyMode {
    REPLACE, // 丢弃设备原有超频配置，整体替换
    MERGE    // 仅覆盖本次配置中出现的字段，其余保持不变
}
