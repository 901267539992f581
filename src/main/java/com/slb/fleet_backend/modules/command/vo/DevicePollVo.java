package com.slb.fleet_backend.modules.command.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Schema(description = "设备轮询响应：当前配置 + 未回报的指令队列")
public class DevicePollVo {
    private Long deviceId;
    private DeviceConfigVo config;

    @Schema(description = "按入队顺序排列；回报前每次轮询都会重复返回")
    private List<CommandVo> commands;

    private LocalDateTime serverTime;
}
