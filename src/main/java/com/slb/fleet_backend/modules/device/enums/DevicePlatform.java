package com.slb.fleet_backend.modules.device.enums;

/**
 * 设备平台类型
 */
public enum DevicePlatform {
    RIG,    // GPU 矿机
    ASIC,   // ASIC 矿机
    DEVICE  // 其他通用设备
}
