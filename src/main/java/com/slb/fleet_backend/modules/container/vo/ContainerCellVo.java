package com.slb.fleet_backend.modules.container.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContainerCellVo {
    private Integer x;
    private Integer y;
    private Long deviceId;
    private Long containerId;
}
