package com.slb.fleet_backend.modules.device.entity;

import com.slb.fleet_backend.modules.device.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 设备消息（指令执行结果等），运维可见；通知渠道的投递由外部通知服务负责。
 */
@Data
public class DeviceMessage {
    private Long id;
    private Long deviceId;
    private Long commandId;
    private MessageType type;
    private String title;
    private String payload;
    private Boolean isRead;
    private LocalDateTime createdAt;
}
