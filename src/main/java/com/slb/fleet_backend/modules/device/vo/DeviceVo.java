package com.slb.fleet_backend.modules.device.vo;

import com.slb.fleet_backend.modules.device.enums.DevicePlatform;
import com.slb.fleet_backend.modules.overclock.domain.OcConfig;
import com.slb.fleet_backend.modules.overclock.enums.OcApplyMode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 设备详情视图对象
 */
@Data
@Schema(description = "设备详情 / Device detail")
public class DeviceVo {
    private Long id;
    private Long farmId;
    private String name;
    private DevicePlatform platform;
    private Boolean active;
    private Boolean online;
    private LocalDateTime lastOnlineTime;
    private List<Long> tagIds;
    private Long flightSheetId;
    private String algorithm;

    private Long ocId;
    private OcApplyMode ocApplyMode;

    @Schema(description = "应当生效的超频配置（resolved）/ Overclock that should apply")
    private OcConfig ocConfig;
    private String ocAlgo;

    @Schema(description = "设备确认已生效的超频配置（actual）/ Overclock confirmed by the device")
    private OcConfig appliedOcConfig;
    private String appliedOcAlgo;

    @Schema(description = "resolved 与 actual 是否一致；不一致表示设备尚未拉取或执行超频指令")
    private Boolean ocInSync;

    private Integer unreadMessageCount;
}
