package com.slb.fleet_backend.modules.device.entity;

import com.slb.fleet_backend.modules.device.enums.DevicePlatform;
import com.slb.fleet_backend.modules.overclock.enums.OcApplyMode;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 设备实体类，对应数据库中的 'devices' 表
 *
 * <p>超频配置分两份：ocConfig/ocAlgo 为"应当生效"的解析结果（resolved），
 * appliedOcConfig/appliedOcAlgo 为设备确认已生效的配置（actual）。设备尚未拉取/执行前两者可能不一致。</p>
 */
@Data
public class Device {
    private Long id;
    private Long farmId;
    private String name;
    private DevicePlatform platform;
    private Boolean active;
    private String passwordHash;

    private Long flightSheetId;
    private String algorithm;
    private String minerConfig; // 存储为 JSON 字符串

    private Long ocId;
    private OcApplyMode ocApplyMode;
    private String ocConfig; // JSON
    private String ocAlgo;
    private String appliedOcConfig; // JSON
    private String appliedOcAlgo;

    private Integer isOnline;
    private LocalDateTime lastOnlineTime;
    private Integer unreadMessageCount;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
    private Boolean isDeleted;
}
