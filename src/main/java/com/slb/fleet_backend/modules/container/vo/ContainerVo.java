package com.slb.fleet_backend.modules.container.vo;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class ContainerVo {
    private Long id;
    private Long farmId;
    private String name;
    private Integer rows;
    private Integer cols;
    private List<ContainerCellVo> cells;
    private LocalDateTime updatedAt;
}
