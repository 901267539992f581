package com.slb.fleet_backend.modules.overclock.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 超频方案，对应 'oc_profiles' 表；配置块以 JSON 字符串存储。
 */
@Data
public class OverclockProfile {
    private Long id;
    private Long farmId;
    private String name;
    private String defaultConfig; // OcConfig JSON
    private String byAlgo;        // List<AlgoOcConfig> JSON
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
