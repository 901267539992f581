package com.slb.fleet_backend.modules.container.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 容器（机架/货柜等网格分组），对应 'containers' 表
 */
@Data
public class Container {
    private Long id;
    private Long farmId;
    private String name;
    private Integer gridRows;
    private Integer gridCols;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
