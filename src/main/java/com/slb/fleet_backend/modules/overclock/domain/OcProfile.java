package com.slb.fleet_backend.modules.overclock.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析后的超频方案：默认块 + 有序的按算法覆盖块。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OcProfile {
    private Long id;
    private OcConfig defaultConfig;
    private List<AlgoOcConfig> byAlgo = new ArrayList<>();
}
