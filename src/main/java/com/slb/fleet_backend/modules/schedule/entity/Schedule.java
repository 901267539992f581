package com.slb.fleet_backend.modules.schedule.entity;

import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 计划任务，对应 'schedules' 表。目标为标签集合或容器（二选一）；时间字段按服务器时区存储。
 */
@Data
public class Schedule {
    private Long id;
    private Long farmId;
    private String name;
    private String targetTagIds; // JSON 数组
    private TagMatch targetTagMatch;
    private Long targetContainerId;
    private String action; // JSON，FleetAction
    private LocalDateTime launchAt;
    private String rrule;
    private String timezone;
    private Boolean active;
    private LocalDateTime prevLaunchAt;
    private LocalDateTime nextLaunchAt;
    private Integer fireCount;
    private String lastRequestId;
    private Long createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
