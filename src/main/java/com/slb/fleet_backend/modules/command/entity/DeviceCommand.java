package com.slb.fleet_backend.modules.command.entity;

import com.slb.fleet_backend.modules.command.enums.CommandStatus;
import com.slb.fleet_backend.modules.command.enums.CommandType;
import com.slb.fleet_backend.modules.device.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 设备指令实体类，对应 'device_commands' 表。同一设备按 id 升序即为队列顺序。
 */
@Data
public class DeviceCommand {
    private Long id;
    private Long deviceId;
    private CommandType commandType;
    private String payload; // JSON
    private CommandStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime resolvedAt;
    private MessageType resultType;
    private String result;
}
