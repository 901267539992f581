package com.slb.fleet_backend.modules.schedule.dto;

import com.slb.fleet_backend.modules.command.domain.FleetAction;
import com.slb.fleet_backend.modules.selection.enums.TagMatch;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class ScheduleSaveDto {

    @NotBlank(message = "计划名称不能为空")
    @Size(max = 128, message = "计划名称不能超过128个字符")
    private String name;

    @Schema(description = "目标标签ID（与 containerId 二选一）")
    private List<Long> tagIds;

    @Schema(description = "标签匹配方式，默认 ANY")
    private TagMatch tagMatch;

    @Schema(description = "目标容器ID（与 tagIds 二选一）")
    private Long containerId;

    @NotNull(message = "缺少计划动作")
    private FleetAction action;

    @NotNull(message = "首次执行时间不能为空")
    @Schema(description = "首次执行时间（按 timezone 解释）", example = "2026-11-01T03:00:00")
    private LocalDateTime launchAt;

    @Schema(description = "iCalendar 重复规则，为空表示只执行一次", example = "FREQ=DAILY;INTERVAL=1;COUNT=3")
    private String rrule;

    @Schema(description = "时区，默认服务器时区", example = "Asia/Shanghai")
    private String timezone;

    @Schema(description = "是否启用，默认启用")
    private Boolean active;
}
