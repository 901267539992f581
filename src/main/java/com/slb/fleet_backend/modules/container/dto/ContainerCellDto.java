package com.slb.fleet_backend.modules.container.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * 格子内容：deviceId 与 containerId 必须且只能填一个
 */
@Data
public class ContainerCellDto {

    @Schema(description = "放入的设备ID")
    private Long deviceId;

    @Schema(description = "放入的子容器ID")
    private Long containerId;
}
