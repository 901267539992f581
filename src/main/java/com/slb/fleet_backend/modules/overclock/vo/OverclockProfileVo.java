package com.slb.fleet_backend.modules.overclock.vo;

import com.slb.fleet_backend.modules.overclock.domain.AlgoOcConfig;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class OverclockProfileVo {
    private Long id;
    private Long farmId;
    private String name;
    private OcConfig defaultConfig;
    private List<AlgoOcConfig> byAlgo;
    private LocalDateTime updatedAt;
}
