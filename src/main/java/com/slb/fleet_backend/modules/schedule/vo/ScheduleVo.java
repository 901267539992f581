package com.slb.fleet_backend.modules.schedule.vo;

import com.slb.fleet_backend.modules.command.domain.FleetAction;
import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 计划详情。launchAt/prevLaunchAt/nextLaunchAt 均按计划时区展示。
 */
@Data
public class ScheduleVo {
    private Long id;
    private Long farmId;
    private String name;
    private List<Long> tagIds;
    private TagMatch tagMatch;
    private Long containerId;
    private FleetAction action;
    private LocalDateTime launchAt;
    private String rrule;
    private String timezone;
    private Boolean active;
    private LocalDateTime prevLaunchAt;
    private LocalDateTime nextLaunchAt;
    private Integer fireCount;
    private String lastRequestId;
    private LocalDateTime updatedAt;
}
