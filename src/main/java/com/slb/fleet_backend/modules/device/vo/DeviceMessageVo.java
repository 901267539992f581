package com.slb.fleet_backend.modules.device.vo;

import com.slb.fleet_backend.modules.device.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class DeviceMessageVo {
    private Long id;
    private Long commandId;
    private MessageType type;
    private String title;
    private String payload;
    private Boolean read;
    private LocalDateTime createdAt;
}
