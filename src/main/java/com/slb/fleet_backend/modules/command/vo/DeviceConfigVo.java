package com.slb.fleet_backend.modules.command.vo;

import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import lombok.Data;

import java.util.Map;

/**
 * 设备当前应当生效的配置
 */
@Data
public class DeviceConfigVo {
    private Long flightSheetId;
    private String algorithm;
    private Map<String, Object> minerConfig;
    private OcConfig ocConfig;
    private String ocAlgo;
}
