package com.slb.fleet_backend.modules.container.entity;

import lombok.Data;

/**
 * 容器格子：deviceId 与 childContainerId 二选一。
 */
@Data
public class ContainerCell {
    private Long containerId;
    private Integer posX;
    private Integer posY;
    private Long deviceId;
    private Long childContainerId;
}
