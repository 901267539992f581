package com.slb.fleet_backend.modules.command.vo;

import com.slb.fleet_backend.modules.command.enums.CommandStatus;
import com.slb.fleet_backend.modules.command.enums.CommandType;
import com.slb.fleet_backend.modules.device.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

@Data
public class CommandVo {
    private Long id;
    private Long deviceId;
    private CommandType type;
    private CommandStatus status;
    private Map<String, Object> payload;
    private LocalDateTime createdAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime resolvedAt;
    private MessageType resultType;
}
