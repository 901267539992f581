package com.slb.fleet_backend.modules.command.enums;

/**
 * 设备指令状态。指令在设备回报前一直留在队列中，轮询只会把 PENDING 置为 DELIVERED。
 */
public enum CommandStatus {
    PENDING,    // 待拉取
    DELIVERED,  // 设备已拉取，尚未回报
    RESOLVED    // 设备已回报结果
}
