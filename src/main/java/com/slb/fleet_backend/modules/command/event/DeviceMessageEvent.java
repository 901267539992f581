package com.slb.fleet_backend.modules.command.event;

import com.slb.fleet_backend.modules.device.enums.MessageType;

/**
 * 设备产生新消息。通知服务订阅该事件，负责推送到外部渠道。
 */
public record DeviceMessageEvent(
        Long farmId,
        Long deviceId,
        Long messageId,
        Long commandId,
        MessageType type,
        String title
) {
}
