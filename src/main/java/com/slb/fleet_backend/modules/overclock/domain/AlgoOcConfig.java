package com.slb.fleet_backend.modules.overclock.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 按算法覆盖的超频块，algo 与设备当前算法匹配时叠加在默认块之上。
 */
@Data
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlgoOcConfig extends OcConfig {
    private String algo;

    public boolean matches(String activeAlgorithm) {
        return algo != null && activeAlgorithm != null && algo.trim().equalsIgnoreCase(activeAlgorithm.trim());
    }
}
